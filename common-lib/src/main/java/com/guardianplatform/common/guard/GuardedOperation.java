package com.guardianplatform.common.guard;

import com.guardianplatform.common.audit.AuditEntry;
import com.guardianplatform.common.exception.PolicyViolationException;
import com.guardianplatform.common.model.Evaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * An {@link Operation} decorated with evaluate → audit → decide → invoke.
 *
 * <ol>
 *   <li>evaluate the state against the guard's policy subset, timing the evaluation;
 *       an evaluator that errors or completes empty counts as a denial</li>
 *   <li>append an audit entry whatever the outcome</li>
 *   <li>denied + enforce: error with {@link PolicyViolationException}, inner not invoked</li>
 *   <li>denied + log-only: log and continue</li>
 *   <li>invoke the inner operation</li>
 * </ol>
 */
public final class GuardedOperation<S, R> implements Operation<S, R> {

    private static final Logger log = LoggerFactory.getLogger(GuardedOperation.class);

    private final String toolName;
    private final Operation<S, R> inner;
    private final ToolGuard<S> guard;

    GuardedOperation(String toolName, Operation<S, R> inner, ToolGuard<S> guard) {
        this.toolName = toolName;
        this.inner = inner;
        this.guard = guard;
    }

    @Override
    public Mono<R> invoke(S state) {
        return Mono.defer(() -> {
            final long start = System.nanoTime();
            return guard.evaluator().evaluate(state, guard.policies())
                .onErrorResume(e -> {
                    log.error("[ToolGuard] Evaluator failed for tool={}: {}", toolName, e.getMessage());
                    return Mono.just(Evaluation.failure(false, "Evaluation failed: " + e.getMessage()));
                })
                .switchIfEmpty(Mono.fromSupplier(() ->
                    Evaluation.failure(false, "Evaluation failed: evaluator returned no result")))
                .flatMap(evaluation -> {
                    double latencyMs = Math.round((System.nanoTime() - start) / 10_000.0) / 100.0;
                    guard.record(AuditEntry.of(toolName, guard.mode(), evaluation, latencyMs));

                    if (!evaluation.allow()) {
                        String summary = evaluation.hasError() && evaluation.violations().isEmpty()
                            ? evaluation.error()
                            : evaluation.violationSummary();
                        if (guard.mode() == GuardMode.ENFORCE) {
                            log.warn("[ToolGuard] BLOCKED tool={} violations={}", toolName, summary);
                            return Mono.error(new PolicyViolationException(
                                "Policy violation in " + toolName + ": " + summary, evaluation));
                        }
                        log.info("[ToolGuard] LOG-ONLY tool={} violations={}", toolName, summary);
                    }
                    return inner.invoke(state);
                });
        });
    }

    public String toolName() {
        return toolName;
    }
}
