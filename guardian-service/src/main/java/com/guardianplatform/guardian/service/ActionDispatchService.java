package com.guardianplatform.guardian.service;

import com.guardianplatform.common.audit.AuditEntry;
import com.guardianplatform.common.guard.GuardStats;
import com.guardianplatform.common.guard.GuardedOperation;
import com.guardianplatform.common.guard.Operation;
import com.guardianplatform.common.guard.ToolGuard;
import com.guardianplatform.guardian.executor.ActionExecutor;
import com.guardianplatform.guardian.model.ActionReceipt;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Executes decisions through the {@link ToolGuard}: every dispatch is evaluated and
 * audited first, and in enforce mode a denied dispatch errors with
 * {@link com.guardianplatform.common.exception.PolicyViolationException} before the
 * executor runs.
 */
@Service
public class ActionDispatchService {

    static final String TOOL_NAME = "action_dispatch";

    private final ToolGuard<Map<String, Object>> toolGuard;
    private final GuardedOperation<Map<String, Object>, ActionReceipt> guardedDispatch;

    public ActionDispatchService(ToolGuard<Map<String, Object>> toolGuard, ActionExecutor executor) {
        this.toolGuard = toolGuard;
        this.guardedDispatch = toolGuard.wrap(TOOL_NAME, Operation.blocking(executor::execute));
    }

    public Mono<ActionReceipt> dispatch(Map<String, Object> state) {
        return guardedDispatch.invoke(state);
    }

    public List<AuditEntry> auditLog() {
        return toolGuard.getAuditLog();
    }

    public GuardStats stats() {
        return toolGuard.getStats();
    }
}
