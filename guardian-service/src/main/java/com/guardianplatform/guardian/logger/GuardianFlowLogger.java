package com.guardianplatform.guardian.logger;

import com.guardianplatform.common.trace.TraceContextUtil;
import com.guardianplatform.guardian.model.GuardianDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logging for the guardian check workflow. Pure side effects, no decisions.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #CHECK_RECEIVED}</li>
 *   <li>{@link #POLICIES_EVALUATED}</li>
 *   <li>{@link #REPAIR_ATTEMPTED} (per round)</li>
 *   <li>{@link #REPAIR_REEVALUATED} (per round)</li>
 *   <li>{@link #VERDICT_ISSUED}</li>
 * </ol>
 *
 * <p>The trace id is read from the Reactor Context and bridged into MDC only for the
 * duration of the log call:
 * <pre>
 *     .doOnEach(flowLogger.stage(GuardianFlowLogger.POLICIES_EVALUATED))
 * </pre>
 */
@Component
public class GuardianFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(GuardianFlowLogger.class);

    public static final String CHECK_RECEIVED     = "CHECK_RECEIVED";
    public static final String POLICIES_EVALUATED = "POLICIES_EVALUATED";
    public static final String REPAIR_ATTEMPTED   = "REPAIR_ATTEMPTED";
    public static final String REPAIR_REEVALUATED = "REPAIR_REEVALUATED";
    public static final String VERDICT_ISSUED     = "VERDICT_ISSUED";

    /** {@code doOnEach} consumer; fires on {@code onNext} only. */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[GuardianFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[GuardianFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    public void logVerdict(GuardianDecision decision) {
        TraceContextUtil.withMdc(decision.traceId(), () ->
            log.info("[GuardianFlow] stage={} traceId={} verdict={} riskLevel={} repairAttempts={} humanOverride={}",
                VERDICT_ISSUED, decision.traceId(), decision.verdict(), decision.riskLevel(),
                decision.repairAttempts(), decision.requiresHumanOverride())
        );
    }
}
