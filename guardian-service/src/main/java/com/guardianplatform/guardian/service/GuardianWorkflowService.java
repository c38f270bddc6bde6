package com.guardianplatform.guardian.service;

import com.guardianplatform.common.context.DecisionStateContextMapper;
import com.guardianplatform.common.model.Evaluation;
import com.guardianplatform.common.repair.RepairResult;
import com.guardianplatform.common.repair.Violation;
import com.guardianplatform.common.trace.TraceContextUtil;
import com.guardianplatform.guardian.logger.GuardianFlowLogger;
import com.guardianplatform.guardian.model.ContextualViolation;
import com.guardianplatform.guardian.model.GuardianDecision;
import com.guardianplatform.guardian.model.GuardianPolicyConfig;
import com.guardianplatform.guardian.model.GuardianVerdict;
import com.guardianplatform.guardian.model.RiskLevel;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Guardian check: evaluate, repair and re-evaluate a proposed decision, then apply the
 * contextual policies to the final action.
 *
 * <pre>
 *   evaluate ── allow ──────────────────────────────▶ APPROVED
 *      │ error (fail-closed) ──────────────────────▶ REJECTED
 *      ▼ violations
 *   repair ─▶ re-evaluate ── allow, no review flag ─▶ REPAIRED
 *      ▲          │ allow, review flag / zero confidence ─▶ REQUIRES_ESCALATION
 *      └── still violating, attempts left ◀┘
 *                 └── attempts exhausted ─────────▶ REQUIRES_ESCALATION
 * </pre>
 *
 * Contextual violations on the final action turn APPROVED and REPAIRED into
 * REQUIRES_ESCALATION, and a critical one (strict mode) into REJECTED. The repair cap
 * is read from the contextual config when the check starts.
 */
@Service
public class GuardianWorkflowService {

    private final PolicyEvaluationService evaluationService;
    private final RepairService repairService;
    private final ContextualPolicyService contextualPolicies;
    private final GuardianFlowLogger flowLogger;

    public GuardianWorkflowService(PolicyEvaluationService evaluationService,
                                   RepairService repairService,
                                   ContextualPolicyService contextualPolicies,
                                   GuardianFlowLogger flowLogger) {
        this.evaluationService = evaluationService;
        this.repairService = repairService;
        this.contextualPolicies = contextualPolicies;
        this.flowLogger = flowLogger;
    }

    public Mono<GuardianDecision> check(Map<String, Object> state, String traceIdHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceIdHeader);
        flowLogger.logWithTraceId(GuardianFlowLogger.CHECK_RECEIVED, traceId);
        GuardianPolicyConfig cfg = contextualPolicies.config();
        int maxAttempts = cfg.maxReflectionAttempts();

        Mono<GuardianDecision> pipeline = evaluationService.evaluateState(state)
            .doOnEach(flowLogger.stage(GuardianFlowLogger.POLICIES_EVALUATED))
            .flatMap(evaluation -> {
                if (evaluation.allow()) {
                    String explanation = evaluation.hasError()
                        ? "Allowed without evaluation (fail-open): " + evaluation.error()
                        : "All applicable policies passed";
                    return Mono.just(decision(traceId, GuardianVerdict.APPROVED, evaluation, null,
                        proposedAction(state), 0, explanation));
                }
                if (evaluation.hasError()) {
                    return Mono.just(decision(traceId, GuardianVerdict.REJECTED, evaluation, null,
                        proposedAction(state), 0, "Blocked, evaluation failed: " + evaluation.error()));
                }
                if (maxAttempts == 0) {
                    return Mono.just(decision(traceId, GuardianVerdict.REQUIRES_ESCALATION, evaluation, null,
                        proposedAction(state), 0, "Repair disabled: " + evaluation.violationSummary()));
                }
                return repairRound(traceId, state, evaluation, 1, maxAttempts);
            })
            .map(decision -> withContextualPolicies(cfg, state, decision))
            .doOnNext(flowLogger::logVerdict);

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    private Mono<GuardianDecision> repairRound(String traceId, Map<String, Object> state,
                                               Evaluation evaluation, int attempt, int maxAttempts) {
        Map<String, Object> action = proposedAction(state);
        return repairService.repair(action,
                evaluation.violations().stream().map(Violation::of).toList(),
                domainContext(state))
            .doOnEach(flowLogger.stage(GuardianFlowLogger.REPAIR_ATTEMPTED))
            .flatMap(repair -> {
                if (repair.confidence() == 0.0) {
                    String reason = repair.error() != null ? repair.error() : repair.repairExplanation();
                    return Mono.just(decision(traceId, GuardianVerdict.REQUIRES_ESCALATION, evaluation, repair,
                        action, attempt, "Repair produced no usable action: " + reason));
                }
                Map<String, Object> repairedState = withAction(state, repair.repairedAction());
                return evaluationService.evaluateState(repairedState)
                    .doOnEach(flowLogger.stage(GuardianFlowLogger.REPAIR_REEVALUATED))
                    .flatMap(reevaluation ->
                        afterReevaluation(traceId, repairedState, reevaluation, repair, attempt, maxAttempts));
            });
    }

    private Mono<GuardianDecision> afterReevaluation(String traceId, Map<String, Object> repairedState,
                                                     Evaluation reevaluation, RepairResult repair,
                                                     int attempt, int maxAttempts) {
        Map<String, Object> repairedAction = repair.repairedAction();
        if (reevaluation.hasError() && !reevaluation.allow()) {
            return Mono.just(decision(traceId, GuardianVerdict.REJECTED, reevaluation, repair,
                repairedAction, attempt, "Blocked, re-evaluation failed: " + reevaluation.error()));
        }
        if (repair.requiresHumanReview()) {
            return Mono.just(decision(traceId, GuardianVerdict.REQUIRES_ESCALATION, reevaluation, repair,
                repairedAction, attempt, "Repair flagged for human review: " + repair.repairExplanation()));
        }
        if (reevaluation.allow()) {
            return Mono.just(decision(traceId, GuardianVerdict.REPAIRED, reevaluation, repair,
                repairedAction, attempt, repair.repairExplanation()));
        }
        if (attempt >= maxAttempts) {
            return Mono.just(decision(traceId, GuardianVerdict.REQUIRES_ESCALATION, reevaluation, repair,
                repairedAction, attempt, "Repair attempts exhausted: " + reevaluation.violationSummary()));
        }
        return repairRound(traceId, repairedState, reevaluation, attempt + 1, maxAttempts);
    }

    private GuardianDecision withContextualPolicies(GuardianPolicyConfig cfg, Map<String, Object> state,
                                                    GuardianDecision decision) {
        boolean capped = decision.repairAttempts() > 0
            && decision.evaluation() != null && !decision.evaluation().allow();
        List<ContextualViolation> contextual = contextualPolicies.assess(
            cfg, state, decision.finalAction(), decision.repairAttempts(), capped);
        RiskLevel risk = RiskLevel.highest(contextual).max(engineRisk(decision.verdict()));
        if (contextual.isEmpty()) {
            return withOutcome(decision, decision.verdict(), decision.explanation(), contextual, risk);
        }

        GuardianVerdict verdict = decision.verdict();
        if (risk == RiskLevel.CRITICAL) {
            verdict = GuardianVerdict.REJECTED;
        } else if (verdict == GuardianVerdict.APPROVED || verdict == GuardianVerdict.REPAIRED) {
            verdict = GuardianVerdict.REQUIRES_ESCALATION;
        }
        String summary = contextual.stream().map(ContextualViolation::description).collect(Collectors.joining("; "));
        return withOutcome(decision, verdict,
            decision.explanation() + ". Policy violations detected: " + summary, contextual, risk);
    }

    private static RiskLevel engineRisk(GuardianVerdict verdict) {
        return switch (verdict) {
            case APPROVED, REPAIRED -> RiskLevel.LOW;
            case REQUIRES_ESCALATION -> RiskLevel.MEDIUM;
            case REJECTED -> RiskLevel.HIGH;
        };
    }

    private static GuardianDecision withOutcome(GuardianDecision d, GuardianVerdict verdict, String explanation,
                                                List<ContextualViolation> contextual, RiskLevel risk) {
        return new GuardianDecision(d.traceId(), verdict, d.evaluation(), d.repair(), d.finalAction(),
            d.repairAttempts(), requiresOverride(verdict), explanation, contextual, risk);
    }

    private static boolean requiresOverride(GuardianVerdict verdict) {
        return verdict == GuardianVerdict.REQUIRES_ESCALATION || verdict == GuardianVerdict.REJECTED;
    }

    private static GuardianDecision decision(String traceId, GuardianVerdict verdict, Evaluation evaluation,
                                             RepairResult repair, Map<String, Object> finalAction,
                                             int attempts, String explanation) {
        return new GuardianDecision(traceId, verdict, evaluation, repair, finalAction, attempts,
            requiresOverride(verdict), explanation, List.of(), RiskLevel.LOW);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> proposedAction(Map<String, Object> state) {
        Object action = state == null ? null : state.get(DecisionStateContextMapper.PROPOSED_ACTION);
        return action instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    private static Map<String, Object> withAction(Map<String, Object> state, Map<String, Object> action) {
        Map<String, Object> next = new LinkedHashMap<>(state);
        next.put(DecisionStateContextMapper.PROPOSED_ACTION, action);
        return next;
    }

    private static Map<String, Object> domainContext(Map<String, Object> state) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        for (String key : new String[] {"domain", "domainConfidence", "domainEntropy", "context"}) {
            if (state.get(key) != null) {
                ctx.put(key, state.get(key));
            }
        }
        return ctx;
    }
}
