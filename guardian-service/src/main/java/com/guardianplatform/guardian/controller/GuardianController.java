package com.guardianplatform.guardian.controller;

import com.guardianplatform.common.audit.AuditEntry;
import com.guardianplatform.common.guard.GuardStats;
import com.guardianplatform.common.model.Evaluation;
import com.guardianplatform.common.policy.EngineStatus;
import com.guardianplatform.common.repair.RepairResult;
import com.guardianplatform.common.repair.Violation;
import com.guardianplatform.common.trace.TraceContextUtil;
import com.guardianplatform.guardian.dto.GuardianConfigPatch;
import com.guardianplatform.guardian.dto.RepairRequest;
import com.guardianplatform.guardian.model.ActionReceipt;
import com.guardianplatform.guardian.model.GuardianDecision;
import com.guardianplatform.guardian.model.GuardianPolicyConfig;
import com.guardianplatform.guardian.service.ActionDispatchService;
import com.guardianplatform.guardian.service.ContextualPolicyService;
import com.guardianplatform.guardian.service.GuardianWorkflowService;
import com.guardianplatform.guardian.service.PolicyEvaluationService;
import com.guardianplatform.guardian.service.RepairService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/guardian")
public class GuardianController {

    private static final String TRACE_HEADER = "X-Trace-Id";

    private final PolicyEvaluationService evaluationService;
    private final RepairService repairService;
    private final GuardianWorkflowService workflowService;
    private final ActionDispatchService dispatchService;
    private final ContextualPolicyService contextualPolicies;

    public GuardianController(PolicyEvaluationService evaluationService,
                              RepairService repairService,
                              GuardianWorkflowService workflowService,
                              ActionDispatchService dispatchService,
                              ContextualPolicyService contextualPolicies) {
        this.evaluationService = evaluationService;
        this.repairService = repairService;
        this.workflowService = workflowService;
        this.dispatchService = dispatchService;
        this.contextualPolicies = contextualPolicies;
    }

    @GetMapping("/status")
    public ResponseEntity<EngineStatus> status() {
        return ResponseEntity.ok(evaluationService.status());
    }

    /** Evaluates a decision state; fail-closed errors come back as {@code allow=false} with {@code error}. */
    @PostMapping("/evaluate")
    public Mono<ResponseEntity<Evaluation>> evaluate(@RequestBody Map<String, Object> state) {
        return evaluationService.evaluateState(state).map(ResponseEntity::ok);
    }

    @PostMapping("/repair")
    public Mono<ResponseEntity<RepairResult>> repair(@RequestBody RepairRequest request) {
        List<Violation> violations = request.violations() == null
            ? List.of()
            : request.violations().stream().map(Violation::fromMessage).toList();
        Map<String, Object> action = request.action() != null ? request.action() : Map.of();
        Map<String, Object> context = request.context() != null ? request.context() : Map.of();
        return repairService.repair(action, violations, context).map(ResponseEntity::ok);
    }

    @PostMapping("/check")
    public Mono<ResponseEntity<GuardianDecision>> check(
            @RequestBody Map<String, Object> state,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        return workflowService.check(state, traceId).map(ResponseEntity::ok);
    }

    /** Guarded dispatch; an enforce-mode block is answered with 403 by the exception handler. */
    @PostMapping("/execute")
    public Mono<ResponseEntity<ActionReceipt>> execute(
            @RequestBody Map<String, Object> state,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        return TraceContextUtil.withTraceId(dispatchService.dispatch(state), TraceContextUtil.resolveTraceId(traceId))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/audit")
    public ResponseEntity<List<AuditEntry>> audit() {
        return ResponseEntity.ok(dispatchService.auditLog());
    }

    @GetMapping("/stats")
    public ResponseEntity<GuardStats> stats() {
        return ResponseEntity.ok(dispatchService.stats());
    }

    @GetMapping("/config")
    public ResponseEntity<GuardianPolicyConfig> config() {
        return ResponseEntity.ok(contextualPolicies.config());
    }

    /** Full replacement; omitted fields take their defaults. */
    @PutMapping("/config")
    public ResponseEntity<GuardianPolicyConfig> replaceConfig(@RequestBody GuardianPolicyConfig config) {
        return ResponseEntity.ok(contextualPolicies.replace(config));
    }

    @PatchMapping("/config")
    public ResponseEntity<GuardianPolicyConfig> patchConfig(@RequestBody GuardianConfigPatch patch) {
        return ResponseEntity.ok(contextualPolicies.patch(patch));
    }

    @GetMapping("/policies")
    public ResponseEntity<Map<String, Object>> policies() {
        return ResponseEntity.ok(contextualPolicies.describePolicies());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
