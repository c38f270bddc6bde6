package com.guardianplatform.guardian.service;

import com.guardianplatform.common.context.DecisionStateContextMapper;
import com.guardianplatform.common.model.Evaluation;
import com.guardianplatform.common.policy.EngineStatus;
import com.guardianplatform.common.policy.PolicyEvaluationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Collection;
import java.util.Map;

/**
 * Reactive front of the {@link PolicyEvaluationEngine}.
 *
 * <p>Rule evaluation runs on the bounded-elastic scheduler. The returned {@code Mono}
 * never errors: scheduling failures are folded into an error evaluation under the
 * configured fail mode, the same as engine-side failures.
 */
@Service
public class PolicyEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluationService.class);

    private final PolicyEvaluationEngine engine;
    private final DecisionStateContextMapper mapper;

    public PolicyEvaluationService(PolicyEvaluationEngine engine, DecisionStateContextMapper mapper) {
        this.engine = engine;
        this.mapper = mapper;
    }

    public Mono<Evaluation> evaluateState(Map<String, Object> state) {
        return evaluateState(state, null);
    }

    /**
     * Maps a decision state and evaluates it.
     *
     * @param policySubset policy names to restrict to; {@code null} or empty means all
     */
    public Mono<Evaluation> evaluateState(Map<String, Object> state, Collection<String> policySubset) {
        return Mono.fromCallable(() -> engine.evaluateState(state, mapper, policySubset))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(this::failure);
    }

    /** Evaluates an already-namespaced context. */
    public Mono<Evaluation> evaluateContext(Map<String, Object> context, Collection<String> policySubset) {
        return Mono.fromCallable(() -> engine.evaluate(context, policySubset))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(this::failure);
    }

    public EngineStatus status() {
        return engine.status();
    }

    private Mono<Evaluation> failure(Throwable e) {
        boolean failClosed = engine.settings().failClosed();
        log.error("[PolicyEngine] Evaluation could not be scheduled. failClosed={} reason={}",
            failClosed, e.getMessage());
        return Mono.just(Evaluation.failure(!failClosed, "Evaluation failed: " + e.getMessage()));
    }
}
