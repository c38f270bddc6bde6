package com.guardianplatform.common.guard;

import com.guardianplatform.common.audit.AuditEntry;
import com.guardianplatform.common.audit.AuditRingBuffer;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Wraps operations so that policy evaluation runs before each call, transparently to
 * the wrapped code.
 *
 * <p>One guard owns one bounded audit log shared by every operation it wraps.
 * Statistics are counted over that log.
 *
 * <pre>
 *     ToolGuard&lt;Map&lt;String, Object&gt;&gt; guard =
 *         new ToolGuard&lt;&gt;(GuardMode.ENFORCE, Set.of("chimera_guards"), 1000, evaluator);
 *     Operation&lt;Map&lt;String, Object&gt;, Receipt&gt; guarded = guard.wrap("dispatch", executor);
 *     guarded.invoke(state);   // errors with PolicyViolationException when blocked
 * </pre>
 */
public final class ToolGuard<S> {

    public static final int DEFAULT_MAX_AUDIT = 1000;

    private final GuardMode mode;
    private final Set<String> policies;
    private final GuardPolicyEvaluator<S> evaluator;
    private final AuditRingBuffer<AuditEntry> auditLog;

    /**
     * @param policies policy names to check; {@code null} or empty means all
     * @param maxAudit audit ring-buffer capacity
     */
    public ToolGuard(GuardMode mode, Set<String> policies, int maxAudit, GuardPolicyEvaluator<S> evaluator) {
        this.mode = mode;
        this.policies = policies == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(policies));
        this.evaluator = evaluator;
        this.auditLog = new AuditRingBuffer<>(maxAudit);
    }

    public <R> GuardedOperation<S, R> wrap(String toolName, Operation<S, R> operation) {
        return new GuardedOperation<>(toolName, operation, this);
    }

    void record(AuditEntry entry) {
        auditLog.append(entry);
    }

    GuardPolicyEvaluator<S> evaluator() {
        return evaluator;
    }

    public List<AuditEntry> getAuditLog() {
        return auditLog.snapshot();
    }

    public GuardStats getStats() {
        int total = auditLog.size();
        int blocked = auditLog.count(e -> !e.allow());
        return new GuardStats(total, blocked, total - blocked, mode, policies);
    }

    public GuardMode mode() {
        return mode;
    }

    public Set<String> policies() {
        return policies;
    }

    public int maxAudit() {
        return auditLog.capacity();
    }
}
