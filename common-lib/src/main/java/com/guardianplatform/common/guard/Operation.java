package com.guardianplatform.common.guard;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.function.Function;

/**
 * A unit of work the guard can wrap. Reactive implementations return their own
 * {@code Mono}; synchronous code is adapted with {@link #blocking(Function)}.
 *
 * @param <S> state handed to the operation and evaluated by the guard
 * @param <R> result type
 */
@FunctionalInterface
public interface Operation<S, R> {

    Mono<R> invoke(S state);

    /**
     * Adapts a synchronous function. The call runs on the bounded-elastic scheduler so it
     * never blocks the caller's event loop.
     */
    static <S, R> Operation<S, R> blocking(Function<S, R> fn) {
        return state -> Mono.fromCallable(() -> fn.apply(state))
            .subscribeOn(Schedulers.boundedElastic());
    }
}
