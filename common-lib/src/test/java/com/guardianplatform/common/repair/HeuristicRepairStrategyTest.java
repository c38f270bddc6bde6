package com.guardianplatform.common.repair;

import com.guardianplatform.common.policy.ViolationKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies bucket selection, numeric scaling and confidence of
 * {@link HeuristicRepairStrategy}.
 */
class HeuristicRepairStrategyTest {

    private static Map<String, Object> action(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }

    // ── bucket behaviour ────────────────────────────────────────────────

    @Nested
    @DisplayName("buckets")
    class BucketTests {

        @Test
        @DisplayName("budget → positive numerics × 0.8, full confidence")
        void budget() {
            Map<String, Object> original = action("actionType", "transfer", "amount", 1000, "fee", 0);

            RepairResult result = HeuristicRepairStrategy.repair(original,
                List.of(Violation.fromMessage("Monthly budget exceeded"))).orElseThrow();

            assertEquals(800.0, (double) result.repairedAction().get("amount"), 1e-9);
            assertEquals(0, result.repairedAction().get("fee"));
            assertEquals("transfer", result.repairedAction().get("actionType"));
            assertEquals(0.85, result.confidence(), 1e-9);
            assertEquals(RepairStrategy.HEURISTIC, result.strategyUsed());
            assertTrue(result.repairExplanation().contains("Reduced amount by 20% (budget)"));
        }

        @Test
        @DisplayName("threshold → positive numerics × 0.9, nested maps included")
        void thresholdNested() {
            Map<String, Object> original = action("parameters", action("amount", 100, "limit", -3), "count", 10);

            RepairResult result = HeuristicRepairStrategy.repair(original,
                List.of(Violation.fromMessage("Threshold breached"))).orElseThrow();

            @SuppressWarnings("unchecked")
            Map<String, Object> params = (Map<String, Object>) result.repairedAction().get("parameters");
            assertEquals(90.0, (double) params.get("amount"), 1e-9);
            assertEquals(-3, params.get("limit"));
            assertEquals(9.0, (double) result.repairedAction().get("count"), 1e-9);
            assertTrue(result.repairExplanation().contains("Reduced parameters.amount by 10%"));
        }

        @Test
        @DisplayName("approval → human review flag and reason, numerics untouched")
        void approval() {
            RepairResult result = HeuristicRepairStrategy.repair(action("amount", 50),
                List.of(Violation.fromMessage("High-risk actions require human approval"))).orElseThrow();

            assertEquals(true, result.repairedAction().get(HeuristicRepairStrategy.REQUIRES_HUMAN_REVIEW));
            assertEquals("High-risk actions require human approval",
                result.repairedAction().get(HeuristicRepairStrategy.REVIEW_REASON));
            assertEquals(50, result.repairedAction().get("amount"));
            assertTrue(result.requiresHumanReview());
        }

        @Test
        @DisplayName("booleans are never scaled")
        void booleansUntouched() {
            RepairResult result = HeuristicRepairStrategy.repair(action("urgent", true, "amount", 10),
                List.of(Violation.fromMessage("cost overrun"))).orElseThrow();
            assertEquals(true, result.repairedAction().get("urgent"));
        }
    }

    // ── accumulation and confidence ─────────────────────────────────────

    @Nested
    @DisplayName("accumulation and confidence")
    class AccumulationTests {

        @Test
        @DisplayName("two budget violations compound → × 0.64")
        void compounding() {
            RepairResult result = HeuristicRepairStrategy.repair(action("amount", 1000),
                List.of(Violation.fromMessage("budget A"), Violation.fromMessage("budget B"))).orElseThrow();
            assertEquals(640.0, (double) result.repairedAction().get("amount"), 1e-9);
            assertEquals(List.of("budget A", "budget B"), result.violationsAddressed());
        }

        @Test
        @DisplayName("mixed matched and unmatched → partial confidence, remainder listed")
        void partial() {
            RepairResult result = HeuristicRepairStrategy.repair(action("amount", 100),
                List.of(Violation.fromMessage("cost overrun"), Violation.fromMessage("PII must be masked")))
                .orElseThrow();
            assertEquals(0.6, result.confidence(), 1e-9);
            assertEquals(List.of("PII must be masked"), result.violationsRemaining());
            assertFalse(result.fullyAddressed());
        }

        @Test
        @DisplayName("declared kind is used instead of the message text")
        void declaredKind() {
            RepairResult result = HeuristicRepairStrategy.repair(action("amount", 1000),
                List.of(new Violation("Junior users cannot transfer more than $1,000",
                    ViolationKind.BUDGET_EXCEEDED))).orElseThrow();
            assertEquals(800.0, (double) result.repairedAction().get("amount"), 1e-9);
        }
    }

    // ── no match ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("no match")
    class NoMatchTests {

        @Test
        @DisplayName("junior transfer message has no keyword → empty")
        void juniorMessage_noMatch() {
            Optional<RepairResult> result = HeuristicRepairStrategy.repair(action("amount", 1500),
                List.of(Violation.fromMessage("Junior users cannot transfer more than $1,000")));
            assertTrue(result.isEmpty());
        }

        @Test
        @DisplayName("caller's action never modified")
        void originalUntouched() {
            Map<String, Object> nested = action("amount", 100);
            Map<String, Object> original = action("amount", 1000, "parameters", nested);

            HeuristicRepairStrategy.repair(original, List.of(Violation.fromMessage("budget")));

            assertEquals(1000, original.get("amount"));
            assertEquals(100, nested.get("amount"));
        }
    }
}
