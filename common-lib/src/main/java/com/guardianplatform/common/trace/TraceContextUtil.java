package com.guardianplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the guardian trace id through reactive pipelines.
 *
 * <p>The Reactor Context is the source of truth for the trace id of a guardian check.
 * MDC is written only for the duration of a single log statement through
 * {@link #withMdc}; it is never used as a persistent ThreadLocal store, because a
 * check may hop between event-loop and bounded-elastic threads.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(workflow.check(state), traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** Uses {@code traceId} when present, otherwise generates one. */
    public static String resolveTraceId(String traceId) {
        return traceId == null || traceId.isBlank() ? UUID.randomUUID().toString() : traceId;
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Never {@code null}; {@value #UNKNOWN} when absent. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
