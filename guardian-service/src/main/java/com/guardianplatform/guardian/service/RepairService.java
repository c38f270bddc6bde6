package com.guardianplatform.guardian.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardianplatform.common.exception.LanguageModelUnavailableException;
import com.guardianplatform.common.exception.RepairParseException;
import com.guardianplatform.common.repair.HeuristicRepairStrategy;
import com.guardianplatform.common.repair.RepairResult;
import com.guardianplatform.common.repair.RepairStrategy;
import com.guardianplatform.common.repair.Violation;
import com.guardianplatform.guardian.ai.LanguageModelClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Proposes a compliant alternative for an action that failed policy evaluation.
 *
 * <h3>Strategies</h3>
 * <ul>
 *   <li>{@code heuristic}: {@link HeuristicRepairStrategy} only</li>
 *   <li>{@code llm}: language-model repair only</li>
 *   <li>{@code hybrid} (default): heuristic first; the model handles whatever the
 *       heuristic left, starting from the heuristic's repaired action</li>
 * </ul>
 *
 * <p>The language-model call is bounded by {@code guardian.repair.llm-timeout-ms} across
 * all retries. Timeouts, an unavailable model and unparseable replies never fail the
 * returned {@code Mono}; they produce a zero-confidence result carrying the original
 * action and an {@code error}.
 */
@Service
public class RepairService {

    private static final Logger log = LoggerFactory.getLogger(RepairService.class);

    static final double HYBRID_ACCEPT_CONFIDENCE = 0.7;
    static final double DEFAULT_LLM_CONFIDENCE = 0.6;
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final LanguageModelClient languageModel;
    private final ObjectMapper objectMapper;
    private final RepairStrategy strategy;
    private final Duration llmTimeout;
    private final int llmMaxRetries;

    public RepairService(LanguageModelClient languageModel,
                         ObjectMapper objectMapper,
                         @Value("${guardian.repair.strategy:hybrid}") String strategy,
                         @Value("${guardian.repair.llm-timeout-ms:10000}") long llmTimeoutMs,
                         @Value("${guardian.repair.llm-max-retries:1}") int llmMaxRetries) {
        this.languageModel = languageModel;
        this.objectMapper = objectMapper;
        this.strategy = RepairStrategy.parse(strategy).orElseGet(() -> {
            log.warn("[Repair] Unknown repair strategy '{}', falling back to hybrid", strategy);
            return RepairStrategy.HYBRID;
        });
        this.llmTimeout = Duration.ofMillis(llmTimeoutMs);
        this.llmMaxRetries = Math.max(0, llmMaxRetries);
        log.info("[Repair] Strategy={} llmTimeoutMs={} llmMaxRetries={}",
            this.strategy.value(), llmTimeoutMs, this.llmMaxRetries);
    }

    public RepairStrategy strategy() {
        return strategy;
    }

    /**
     * @param action        the rejected action; never modified
     * @param violations    what the action violated
     * @param domainContext extra context shown to the language model, may be empty
     */
    public Mono<RepairResult> repair(Map<String, Object> action, List<Violation> violations,
                                     Map<String, Object> domainContext) {
        Map<String, Object> original = HeuristicRepairStrategy.deepCopy(action);
        if (violations == null || violations.isEmpty()) {
            return Mono.just(RepairResult.nothingToRepair(strategy, original));
        }
        Mono<RepairResult> result = switch (strategy) {
            case HEURISTIC -> Mono.just(heuristicOnly(original, violations));
            case LLM       -> llmRepair(original, violations, domainContext);
            case HYBRID    -> hybrid(original, violations, domainContext);
        };
        return result.doOnNext(r -> log.info(
            "[Repair] Repair complete. strategy={} confidence={} addressed={} remaining={}",
            r.strategyUsed().value(), r.confidence(), r.violationsAddressed().size(),
            r.violationsRemaining().size()));
    }

    private RepairResult heuristicOnly(Map<String, Object> action, List<Violation> violations) {
        return HeuristicRepairStrategy.repair(action, violations)
            .orElseGet(() -> RepairResult.unrepaired(RepairStrategy.HEURISTIC, action,
                messages(violations), "No heuristic matched the violations", null));
    }

    private Mono<RepairResult> hybrid(Map<String, Object> action, List<Violation> violations,
                                      Map<String, Object> domainContext) {
        Optional<RepairResult> heuristic = HeuristicRepairStrategy.repair(action, violations);
        if (heuristic.isEmpty()) {
            log.debug("[Repair] No heuristic match, escalating {} violation(s) to the language model",
                violations.size());
            return llmRepair(action, violations, domainContext);
        }
        RepairResult first = heuristic.get();
        if (first.fullyAddressed() && first.confidence() >= HYBRID_ACCEPT_CONFIDENCE) {
            return Mono.just(first);
        }
        List<Violation> remaining = violations.stream()
            .filter(v -> first.violationsRemaining().contains(v.message()))
            .toList();
        return llmRepair(first.repairedAction(), remaining, domainContext)
            .map(llm -> merge(action, first, llm));
    }

    private RepairResult merge(Map<String, Object> original, RepairResult heuristic, RepairResult llm) {
        Set<String> addressed = new LinkedHashSet<>(heuristic.violationsAddressed());
        addressed.addAll(llm.violationsAddressed());
        return new RepairResult(
            RepairStrategy.HYBRID,
            original,
            llm.repairedAction(),
            "Heuristic: " + heuristic.repairExplanation() + "; LLM: " + llm.repairExplanation(),
            (heuristic.confidence() + llm.confidence()) / 2.0,
            new ArrayList<>(addressed),
            llm.violationsRemaining(),
            llm.error());
    }

    // ── language-model repair ─────────────────────────────────────────────

    Mono<RepairResult> llmRepair(Map<String, Object> action, List<Violation> violations,
                                 Map<String, Object> domainContext) {
        List<String> messages = messages(violations);
        return Mono.fromCallable(() -> buildPrompt(action, messages, domainContext))
            .flatMap(prompt -> languageModel.complete(prompt)
                .retryWhen(Retry.backoff(llmMaxRetries, RETRY_BACKOFF)
                    .filter(e -> !(e instanceof LanguageModelUnavailableException))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .timeout(llmTimeout))
            .map(text -> parseResponse(action, messages, text))
            .onErrorResume(e -> Mono.just(degraded(action, messages, Exceptions.unwrap(e))));
    }

    private RepairResult degraded(Map<String, Object> action, List<String> messages, Throwable e) {
        if (e instanceof TimeoutException) {
            String error = "LLM repair timed out after " + llmTimeout.toMillis() + "ms";
            log.warn("[Repair] {}", error);
            return RepairResult.unrepaired(RepairStrategy.LLM, action, messages, error, error);
        }
        if (e instanceof RepairParseException) {
            log.warn("[Repair] Model response could not be parsed: {}", e.getMessage());
            return RepairResult.unrepaired(RepairStrategy.LLM, action, messages,
                "LLM response could not be parsed", e.getMessage());
        }
        if (e instanceof LanguageModelUnavailableException) {
            log.warn("[Repair] Language model unavailable: {}", e.getMessage());
            return RepairResult.unrepaired(RepairStrategy.LLM, action, messages,
                "LLM repair unavailable", e.getMessage());
        }
        log.error("[Repair] Language model call failed. reason={}", e.getMessage(), e);
        return RepairResult.unrepaired(RepairStrategy.LLM, action, messages,
            "LLM repair failed: " + e.getMessage(), e.getMessage());
    }

    String buildPrompt(Map<String, Object> action, List<String> violations,
                       Map<String, Object> domainContext) throws JsonProcessingException {
        StringBuilder bullets = new StringBuilder();
        for (String v : violations) {
            bullets.append("- ").append(v).append('\n');
        }
        String context = domainContext == null || domainContext.isEmpty()
            ? "unknown"
            : objectMapper.writeValueAsString(domainContext);
        return String.format("""
            You are a policy compliance repair assistant.
            The following action was rejected by a policy guardian.

            Action:
            %s

            Violations:
            %s
            Domain context: %s

            Repair the action to address ALL violations while preserving its intent.
            Respond with ONLY a JSON object with keys:
              repaired_action      (object, the full repaired action)
              explanation          (string)
              confidence           (number between 0 and 1)
              violations_remaining (array of violation strings you could not address, optional)
            """, objectMapper.writeValueAsString(action), bullets, context);
    }

    /**
     * @throws RepairParseException when the reply is not JSON or lacks a
     *         {@code repaired_action} object
     */
    RepairResult parseResponse(Map<String, Object> action, List<String> violations, String responseText) {
        if (responseText == null || responseText.isBlank()) {
            throw new RepairParseException("Empty model response");
        }
        String cleaned = responseText
            .replaceAll("```json", "")
            .replaceAll("```", "")
            .trim();
        JsonNode json;
        try {
            json = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            throw new RepairParseException("Model response is not valid JSON", e);
        }
        if (json == null || !json.path("repaired_action").isObject()) {
            throw new RepairParseException("Model response has no repaired_action object");
        }
        Map<String, Object> repaired = objectMapper.convertValue(json.path("repaired_action"), MAP_TYPE);
        String explanation = json.path("explanation").asText("LLM repair applied");
        double confidence = json.path("confidence").asDouble(DEFAULT_LLM_CONFIDENCE);

        List<String> remaining = new ArrayList<>();
        JsonNode reported = json.path("violations_remaining");
        if (reported.isArray()) {
            reported.forEach(node -> {
                if (violations.contains(node.asText())) {
                    remaining.add(node.asText());
                }
            });
        }
        List<String> addressed = violations.stream().filter(v -> !remaining.contains(v)).toList();
        return new RepairResult(RepairStrategy.LLM, action, repaired, explanation, confidence,
            addressed, remaining, null);
    }

    private static List<String> messages(List<Violation> violations) {
        return violations.stream().map(Violation::message).toList();
    }
}
