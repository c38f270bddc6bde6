package com.guardianplatform.common.guard;

import com.guardianplatform.common.audit.AuditEntry;
import com.guardianplatform.common.context.DecisionStateContextMapper;
import com.guardianplatform.common.exception.PolicyConfigurationException;
import com.guardianplatform.common.exception.PolicyViolationException;
import com.guardianplatform.common.policy.BuiltInPolicies;
import com.guardianplatform.common.policy.EngineSettings;
import com.guardianplatform.common.policy.PolicyEvaluationEngine;
import com.guardianplatform.common.policy.PolicyRegistryHolder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ToolGuardTest {

    private static final PolicyEvaluationEngine ENGINE = new PolicyEvaluationEngine(
        new PolicyRegistryHolder(BuiltInPolicies.load()), EngineSettings.defaults());
    private static final DecisionStateContextMapper MAPPER = new DecisionStateContextMapper();

    private static final GuardPolicyEvaluator<Map<String, Object>> EVALUATOR =
        (state, policies) -> Mono.fromCallable(() -> ENGINE.evaluateState(state, MAPPER, policies));

    private static Map<String, Object> transfer(double amount) {
        return Map.of(
            "proposedAction", Map.of("actionType", "transfer", "amount", amount),
            "context", Map.of("userRole", "junior"));
    }

    private final AtomicInteger calls = new AtomicInteger();

    private Operation<Map<String, Object>, String> countingOperation() {
        return state -> Mono.fromSupplier(() -> "executed-" + calls.incrementAndGet());
    }

    @Nested
    @DisplayName("enforce mode")
    class EnforceTests {

        private final ToolGuard<Map<String, Object>> guard =
            new ToolGuard<>(GuardMode.ENFORCE, Set.of(), 10, EVALUATOR);

        @Test
        @DisplayName("denied → PolicyViolationException, inner never invoked, audit recorded")
        void denied_blocks() {
            StepVerifier.create(guard.wrap("transfer_funds", countingOperation()).invoke(transfer(1500)))
                .expectErrorSatisfies(e -> {
                    PolicyViolationException pve = assertInstanceOf(PolicyViolationException.class, e);
                    assertTrue(pve.getMessage().contains("Policy violation in transfer_funds"));
                    assertTrue(pve.getMessage().contains("Junior users cannot transfer more than $1,000"));
                    assertFalse(pve.getEvaluation().allow());
                })
                .verify();

            assertEquals(0, calls.get());
            List<AuditEntry> audit = guard.getAuditLog();
            assertEquals(1, audit.size());
            AuditEntry entry = audit.get(0);
            assertEquals("transfer_funds", entry.toolName());
            assertFalse(entry.allow());
            assertEquals(GuardMode.ENFORCE, entry.mode());
            assertEquals("junior_transfer_limit", entry.violations().get(0).rule());
            assertTrue(entry.latencyMs() >= 0);
        }

        @Test
        @DisplayName("allowed → inner invoked once, result passed through")
        void allowed_invokes() {
            StepVerifier.create(guard.wrap("transfer_funds", countingOperation()).invoke(transfer(500)))
                .expectNext("executed-1")
                .verifyComplete();
            assertTrue(guard.getAuditLog().get(0).allow());
        }

        @Test
        @DisplayName("nothing happens until subscription")
        void lazy() {
            guard.wrap("transfer_funds", countingOperation()).invoke(transfer(500));
            assertTrue(guard.getAuditLog().isEmpty());
            assertEquals(0, calls.get());
        }
    }

    @Nested
    @DisplayName("log-only mode")
    class LogOnlyTests {

        @Test
        @DisplayName("denied → inner still invoked, denial audited")
        void denied_proceeds() {
            ToolGuard<Map<String, Object>> guard = new ToolGuard<>(GuardMode.LOG_ONLY, Set.of(), 10, EVALUATOR);

            StepVerifier.create(guard.wrap("transfer_funds", countingOperation()).invoke(transfer(1500)))
                .expectNext("executed-1")
                .verifyComplete();

            assertFalse(guard.getAuditLog().get(0).allow());
            assertEquals(GuardMode.LOG_ONLY, guard.getStats().mode());
        }
    }

    @Nested
    @DisplayName("stats and audit")
    class StatsTests {

        @Test
        @DisplayName("stats count allowed and blocked across wrapped operations")
        void stats() {
            ToolGuard<Map<String, Object>> guard = new ToolGuard<>(GuardMode.ENFORCE,
                Set.of(BuiltInPolicies.BUDGET_LIMITS), 10, EVALUATOR);
            GuardedOperation<Map<String, Object>, String> a = guard.wrap("a", countingOperation());
            GuardedOperation<Map<String, Object>, String> b = guard.wrap("b", countingOperation());

            a.invoke(transfer(100)).block();
            StepVerifier.create(b.invoke(transfer(5000))).expectError(PolicyViolationException.class).verify();
            b.invoke(transfer(200)).block();

            GuardStats stats = guard.getStats();
            assertEquals(3, stats.totalChecks());
            assertEquals(1, stats.blocked());
            assertEquals(2, stats.allowed());
            assertEquals(Set.of(BuiltInPolicies.BUDGET_LIMITS), stats.policies());
        }

        @Test
        @DisplayName("policy subset keeps the order it was configured in")
        void policiesOrdered() {
            List<String> configured = List.of(BuiltInPolicies.CHIMERA_GUARDS,
                BuiltInPolicies.BUDGET_LIMITS, BuiltInPolicies.DATA_ACCESS);
            ToolGuard<Map<String, Object>> guard = new ToolGuard<>(GuardMode.ENFORCE,
                new LinkedHashSet<>(configured), 10, EVALUATOR);

            assertEquals(configured, List.copyOf(guard.getStats().policies()));
        }

        @Test
        @DisplayName("audit log bounded by maxAudit")
        void bounded() {
            ToolGuard<Map<String, Object>> guard = new ToolGuard<>(GuardMode.LOG_ONLY, Set.of(), 3, EVALUATOR);
            GuardedOperation<Map<String, Object>, String> op = guard.wrap("op", countingOperation());
            for (int i = 0; i < 7; i++) {
                op.invoke(transfer(100 + i)).block();
            }
            assertEquals(3, guard.getAuditLog().size());
            assertEquals(3, guard.getStats().totalChecks());
            assertEquals(3, guard.maxAudit());
        }

        @Test
        @DisplayName("error evaluation, fail-closed → blocked with the error as reason")
        void errorEvaluation_blocks() {
            ToolGuard<Map<String, Object>> guard = new ToolGuard<>(GuardMode.ENFORCE, Set.of(), 10, EVALUATOR);
            StepVerifier.create(guard.wrap("op", countingOperation()).invoke(Map.of("proposedAction", 42)))
                .expectErrorSatisfies(e -> assertTrue(e.getMessage().contains("Context mapping failed")))
                .verify();
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("evaluator signals an error → blocked as a denial and audited")
        void evaluatorError_blocks() {
            ToolGuard<Map<String, Object>> guard = new ToolGuard<>(GuardMode.ENFORCE, Set.of(), 10,
                (state, policies) -> Mono.error(new IllegalStateException("evaluator down")));

            StepVerifier.create(guard.wrap("op", countingOperation()).invoke(transfer(100)))
                .expectErrorSatisfies(e -> {
                    PolicyViolationException pve = assertInstanceOf(PolicyViolationException.class, e);
                    assertTrue(pve.getMessage().contains("evaluator down"));
                    assertTrue(pve.getEvaluation().hasError());
                })
                .verify();

            assertEquals(0, calls.get());
            assertEquals(1, guard.getAuditLog().size());
            assertFalse(guard.getAuditLog().get(0).allow());
            assertEquals(1, guard.getStats().blocked());
        }

        @Test
        @DisplayName("evaluator completes empty → blocked as a denial and audited")
        void evaluatorEmpty_blocks() {
            ToolGuard<Map<String, Object>> guard = new ToolGuard<>(GuardMode.ENFORCE, Set.of(), 10,
                (state, policies) -> Mono.empty());

            StepVerifier.create(guard.wrap("op", countingOperation()).invoke(transfer(100)))
                .expectError(PolicyViolationException.class)
                .verify();

            assertEquals(0, calls.get());
            assertEquals(1, guard.getAuditLog().size());
            assertFalse(guard.getAuditLog().get(0).allow());
        }

        @Test
        @DisplayName("evaluator error in log-only mode → inner still invoked, denial audited")
        void evaluatorError_logOnly() {
            ToolGuard<Map<String, Object>> guard = new ToolGuard<>(GuardMode.LOG_ONLY, Set.of(), 10,
                (state, policies) -> Mono.error(new IllegalStateException("evaluator down")));

            StepVerifier.create(guard.wrap("op", countingOperation()).invoke(transfer(100)))
                .expectNext("executed-1")
                .verifyComplete();
            assertFalse(guard.getAuditLog().get(0).allow());
        }
    }

    @Nested
    @DisplayName("blocking adapter and mode parsing")
    class AdapterTests {

        @Test
        @DisplayName("synchronous function adapted and guarded")
        void blockingAdapter() {
            ToolGuard<Map<String, Object>> guard = new ToolGuard<>(GuardMode.ENFORCE, Set.of(), 10, EVALUATOR);
            Operation<Map<String, Object>, Integer> sync = Operation.blocking(state -> state.size());

            StepVerifier.create(guard.wrap("sync", sync).invoke(transfer(10)))
                .expectNext(2)
                .verifyComplete();
        }

        @Test
        @DisplayName("mode strings parse, unknown values rejected")
        void modeParsing() {
            assertEquals(GuardMode.ENFORCE, GuardMode.fromValue("enforce"));
            assertEquals(GuardMode.LOG_ONLY, GuardMode.fromValue(" LOG-ONLY "));
            assertThrows(PolicyConfigurationException.class, () -> GuardMode.fromValue("audit"));
        }
    }
}
