package com.guardianplatform.guardian.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardianplatform.common.exception.LanguageModelUnavailableException;
import com.guardianplatform.common.repair.RepairResult;
import com.guardianplatform.common.repair.RepairStrategy;
import com.guardianplatform.common.repair.Violation;
import com.guardianplatform.guardian.ai.LanguageModelClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RepairServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String JUNIOR_MESSAGE = "Junior users cannot transfer more than $1,000";

    private static final LanguageModelClient UNUSED = prompt -> Mono.error(new AssertionError("model must not be called"));

    private static RepairService service(String strategy, LanguageModelClient client) {
        return new RepairService(client, MAPPER, strategy, 2000, 1);
    }

    private static Map<String, Object> transfer(int amount) {
        return Map.of("actionType", "transfer", "amount", amount);
    }

    private static List<Violation> violations(String... messages) {
        return Arrays.stream(messages).map(Violation::fromMessage).toList();
    }

    private static RepairResult run(Mono<RepairResult> mono) {
        AtomicReference<RepairResult> ref = new AtomicReference<>();
        StepVerifier.create(mono).consumeNextWith(ref::set).verifyComplete();
        return ref.get();
    }

    // ── common behaviour ────────────────────────────────────────────────

    @Nested
    @DisplayName("strategy selection and empty input")
    class CommonTests {

        @Test
        @DisplayName("no violations → unchanged action, confidence 1.0, model untouched")
        void noViolations() {
            RepairResult result = run(service("hybrid", UNUSED).repair(transfer(10), List.of(), Map.of()));
            assertEquals(1.0, result.confidence());
            assertEquals(transfer(10), result.repairedAction());
            assertTrue(result.violationsRemaining().isEmpty());
        }

        @Test
        @DisplayName("unknown strategy → hybrid")
        void unknownStrategy() {
            assertEquals(RepairStrategy.HYBRID, service("aggressive", UNUSED).strategy());
            assertEquals(RepairStrategy.LLM, service(" LLM ", UNUSED).strategy());
        }

        @Test
        @DisplayName("heuristic strategy, no match → original action, confidence 0, all remaining")
        void heuristicNoMatch() {
            RepairResult result = run(service("heuristic", UNUSED)
                .repair(transfer(1500), violations(JUNIOR_MESSAGE), Map.of()));
            assertEquals(0.0, result.confidence());
            assertEquals(transfer(1500), result.repairedAction());
            assertEquals(List.of(JUNIOR_MESSAGE), result.violationsRemaining());
            assertEquals(RepairStrategy.HEURISTIC, result.strategyUsed());
        }
    }

    // ── hybrid ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("hybrid")
    class HybridTests {

        @Test
        @DisplayName("heuristic fully addresses → model never called")
        void heuristicSufficient() {
            RepairResult result = run(service("hybrid", UNUSED)
                .repair(transfer(1000), violations("budget exceeded"), Map.of()));
            assertEquals(RepairStrategy.HEURISTIC, result.strategyUsed());
            assertEquals(0.85, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("budget + unrecognized → merged: both addressed, confidence is the mean")
        void partialThenModel() {
            AtomicReference<String> prompt = new AtomicReference<>();
            LanguageModelClient stub = p -> {
                prompt.set(p);
                return Mono.just("""
                    {"repaired_action": {"actionType": "transfer", "amount": 700, "masked": true},
                     "explanation": "Masked the payload", "confidence": 0.9}
                    """);
            };

            RepairResult result = run(service("hybrid", stub)
                .repair(transfer(1000), violations("budget exceeded", "PII must be masked"), Map.of("domain", "Complex")));

            assertEquals(RepairStrategy.HYBRID, result.strategyUsed());
            assertEquals(List.of("budget exceeded", "PII must be masked"), result.violationsAddressed());
            assertTrue(result.violationsRemaining().isEmpty());
            assertEquals((0.6 + 0.9) / 2, result.confidence(), 1e-9);
            assertTrue(result.repairExplanation().startsWith("Heuristic: Reduced amount by 20% (budget); LLM: "));
            assertEquals(transfer(1000), result.originalAction());
            assertEquals(700, result.repairedAction().get("amount"));

            assertTrue(prompt.get().contains("- PII must be masked"));
            assertFalse(prompt.get().contains("- budget exceeded"));
            assertTrue(prompt.get().contains("800.0"), "model starts from the heuristic's repaired action");
            assertTrue(prompt.get().contains("Complex"));
        }

        @Test
        @DisplayName("junior message, no heuristic match → escalated to the model")
        void juniorEscalatesToModel() {
            AtomicInteger calls = new AtomicInteger();
            LanguageModelClient stub = p -> {
                calls.incrementAndGet();
                return Mono.just("{\"repaired_action\": {\"actionType\": \"transfer\", \"amount\": 1000}, "
                    + "\"explanation\": \"Capped at junior limit\", \"confidence\": 0.8}");
            };

            RepairResult result = run(service("hybrid", stub)
                .repair(transfer(1500), violations(JUNIOR_MESSAGE), Map.of()));

            assertEquals(1, calls.get());
            assertEquals(RepairStrategy.LLM, result.strategyUsed());
            assertEquals(1000, result.repairedAction().get("amount"));
            assertEquals(0.8, result.confidence(), 1e-9);
            assertEquals(List.of(JUNIOR_MESSAGE), result.violationsAddressed());
        }
    }

    // ── model failures ──────────────────────────────────────────────────

    @Nested
    @DisplayName("language-model degradation")
    class DegradationTests {

        @Test
        @DisplayName("model never answers → timeout result, original action, confidence 0")
        void timeout() {
            RepairService service = new RepairService(p -> Mono.never(), MAPPER, "llm", 50, 0);
            RepairResult result = run(service.repair(transfer(1500), violations(JUNIOR_MESSAGE), Map.of()));

            assertEquals(0.0, result.confidence());
            assertEquals(transfer(1500), result.repairedAction());
            assertEquals("LLM repair timed out after 50ms", result.error());
            assertEquals(List.of(JUNIOR_MESSAGE), result.violationsRemaining());
        }

        @Test
        @DisplayName("unparseable reply → original action, confidence 0, error set")
        void parseFailure() {
            RepairResult result = run(service("llm", p -> Mono.just("I would lower the amount."))
                .repair(transfer(1500), violations(JUNIOR_MESSAGE), Map.of()));
            assertEquals(0.0, result.confidence());
            assertEquals(transfer(1500), result.repairedAction());
            assertNotNull(result.error());
        }

        @Test
        @DisplayName("reply without repaired_action object → parse failure")
        void missingRepairedAction() {
            RepairResult result = run(service("llm", p -> Mono.just("{\"repaired_action\": \"lower it\"}"))
                .repair(transfer(1500), violations(JUNIOR_MESSAGE), Map.of()));
            assertEquals(0.0, result.confidence());
            assertTrue(result.error().contains("repaired_action"));
        }

        @Test
        @DisplayName("fenced JSON reply → fences stripped, confidence clamped")
        void fencedReply() {
            String reply = "```json\n{\"repaired_action\": {\"amount\": 900}, \"confidence\": 1.7, "
                + "\"violations_remaining\": [\"" + JUNIOR_MESSAGE + "\"]}\n```";
            RepairResult result = run(service("llm", p -> Mono.just(reply))
                .repair(transfer(1500), violations(JUNIOR_MESSAGE), Map.of()));
            assertEquals(1.0, result.confidence());
            assertEquals(900, result.repairedAction().get("amount"));
            assertEquals(List.of(JUNIOR_MESSAGE), result.violationsRemaining());
            assertTrue(result.violationsAddressed().isEmpty());
        }

        @Test
        @DisplayName("no API key → unavailable result without retrying")
        void unavailable() {
            AtomicInteger calls = new AtomicInteger();
            LanguageModelClient stub = p -> Mono.defer(() -> {
                calls.incrementAndGet();
                return Mono.error(new LanguageModelUnavailableException("No Anthropic API key configured"));
            });
            RepairResult result = run(new RepairService(stub, MAPPER, "llm", 2000, 3)
                .repair(transfer(1500), violations(JUNIOR_MESSAGE), Map.of()));
            assertEquals(1, calls.get());
            assertEquals(0.0, result.confidence());
            assertTrue(result.error().contains("No Anthropic API key"));
        }

        @Test
        @DisplayName("transient failure → retried, second answer used")
        void retried() {
            AtomicInteger calls = new AtomicInteger();
            LanguageModelClient stub = p -> Mono.defer(() -> calls.incrementAndGet() == 1
                ? Mono.error(new IllegalStateException("502 from upstream"))
                : Mono.just("{\"repaired_action\": {\"amount\": 950}, \"confidence\": 0.7}"));
            RepairResult result = run(service("llm", stub)
                .repair(transfer(1500), violations(JUNIOR_MESSAGE), Map.of()));
            assertEquals(2, calls.get());
            assertEquals(950, result.repairedAction().get("amount"));
            assertNull(result.error());
        }
    }
}
