package com.guardianplatform.common.guard;

import com.guardianplatform.common.model.Evaluation;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Evaluation hook the guard calls before every wrapped invocation.
 *
 * <p>Implementations must never signal an error: failures are expected to come back
 * as an {@link Evaluation} with {@code error} set, decided by the fail mode.
 */
@FunctionalInterface
public interface GuardPolicyEvaluator<S> {

    /**
     * @param policySubset policy names to restrict to; empty means all
     */
    Mono<Evaluation> evaluate(S state, Set<String> policySubset);
}
