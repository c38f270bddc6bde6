package com.guardianplatform.guardian.ai;

import reactor.core.publisher.Mono;

/**
 * Text-in, text-out access to a hosted language model.
 *
 * <p>Implementations do not apply their own timeout or retry; callers bound the call.
 * An unconfigured client signals
 * {@link com.guardianplatform.common.exception.LanguageModelUnavailableException}.
 */
@FunctionalInterface
public interface LanguageModelClient {

    Mono<String> complete(String prompt);
}
