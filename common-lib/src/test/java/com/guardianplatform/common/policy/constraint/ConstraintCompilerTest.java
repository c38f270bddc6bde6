package com.guardianplatform.common.policy.constraint;

import com.guardianplatform.common.exception.PolicyConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintCompilerTest {

    private static Constraint single(Object raw) {
        List<PathConstraint> compiled = ConstraintCompiler.compile("r", Map.of("p", raw));
        assertEquals(1, compiled.size());
        assertEquals("p", compiled.get(0).path());
        return compiled.get(0).constraint();
    }

    // ── variant selection ───────────────────────────────────────────────

    @Nested
    @DisplayName("compile(): variant selection")
    class VariantTests {

        @Test
        @DisplayName("bare number → upper bound, inclusive")
        void number_upperBound() {
            Constraint c = single(1000);
            assertInstanceOf(UpperBoundConstraint.class, c);
            assertTrue(c.isSatisfiedBy(1000));
            assertTrue(c.isSatisfiedBy(999.99));
            assertTrue(c.isSatisfiedBy(-5));
            assertFalse(c.isSatisfiedBy(1000.01));
            assertFalse(c.isSatisfiedBy("1000"));
        }

        @Test
        @DisplayName("min/max map → range, both ends inclusive")
        void range_inclusive() {
            Constraint c = single(Map.of("min", -1.0, "max", 1.0));
            assertInstanceOf(RangeConstraint.class, c);
            assertTrue(c.isSatisfiedBy(-1.0));
            assertTrue(c.isSatisfiedBy(1));
            assertFalse(c.isSatisfiedBy(1.0001));
            assertFalse(c.isSatisfiedBy(-1.5));
            assertFalse(c.isSatisfiedBy(true));
        }

        @Test
        @DisplayName("min only → unbounded above")
        void minOnly() {
            Constraint c = single(Map.of("min", 0.5));
            assertTrue(c.isSatisfiedBy(0.5));
            assertTrue(c.isSatisfiedBy(1e9));
            assertFalse(c.isSatisfiedBy(0.49));
        }

        @Test
        @DisplayName("boolean → exact boolean match, numbers never match")
        void booleanConstraint() {
            Constraint c = single(true);
            assertInstanceOf(BooleanConstraint.class, c);
            assertTrue(c.isSatisfiedBy(true));
            assertFalse(c.isSatisfiedBy(false));
            assertFalse(c.isSatisfiedBy(1));
        }

        @Test
        @DisplayName("string scalar → equality")
        void scalar_equality() {
            Constraint c = single("approved");
            assertInstanceOf(EqualityConstraint.class, c);
            assertTrue(c.isSatisfiedBy("approved"));
            assertFalse(c.isSatisfiedBy("pending"));
        }

        @Test
        @DisplayName("neq → passes on anything but the value")
        void neq() {
            Constraint c = single(Map.of("neq", "delete"));
            assertTrue(c.isSatisfiedBy("archive"));
            assertFalse(c.isSatisfiedBy("delete"));
        }

        @Test
        @DisplayName("eq compares numbers by value")
        void eq_numeric() {
            Constraint c = single(Map.of("eq", 3));
            assertTrue(c.isSatisfiedBy(3.0));
            assertFalse(c.isSatisfiedBy(4));
        }

        @Test
        @DisplayName("range plus neq on one path → two entries, range first")
        void combined() {
            Map<String, Object> ops = new LinkedHashMap<>();
            ops.put("neq", 0);
            ops.put("max", 10);
            List<PathConstraint> compiled = ConstraintCompiler.compile("r", Map.of("p", ops));
            assertEquals(2, compiled.size());
            assertInstanceOf(RangeConstraint.class, compiled.get(0).constraint());
            assertInstanceOf(EqualityConstraint.class, compiled.get(1).constraint());
        }
    }

    // ── rejected input ──────────────────────────────────────────────────

    @Nested
    @DisplayName("compile(): rejected definitions")
    class RejectionTests {

        @Test
        @DisplayName("unknown operator → configuration error")
        void unknownOperator() {
            PolicyConfigurationException e = assertThrows(PolicyConfigurationException.class,
                () -> ConstraintCompiler.compile("r", Map.of("p", Map.of("gte", 5))));
            assertTrue(e.getMessage().contains("gte"));
        }

        @Test
        @DisplayName("empty operator map → configuration error")
        void emptyMap() {
            assertThrows(PolicyConfigurationException.class,
                () -> ConstraintCompiler.compile("r", Map.of("p", Map.of())));
        }

        @Test
        @DisplayName("min greater than max → configuration error")
        void minAboveMax() {
            assertThrows(PolicyConfigurationException.class,
                () -> ConstraintCompiler.compile("r", Map.of("p", Map.of("min", 5, "max", 1))));
        }

        @Test
        @DisplayName("non-numeric bound → configuration error")
        void nonNumericBound() {
            assertThrows(PolicyConfigurationException.class,
                () -> ConstraintCompiler.compile("r", Map.of("p", Map.of("max", "ten"))));
        }

        @Test
        @DisplayName("explicit null min or max → configuration error")
        void nullBound() {
            Map<String, Object> nullMin = new HashMap<>();
            nullMin.put("min", null);
            Map<String, Object> nullMax = new HashMap<>();
            nullMax.put("min", 0);
            nullMax.put("max", null);

            PolicyConfigurationException e = assertThrows(PolicyConfigurationException.class,
                () -> ConstraintCompiler.compile("r", Map.of("action.amount", nullMin)));
            assertTrue(e.getMessage().contains("'min'"));
            assertThrows(PolicyConfigurationException.class,
                () -> ConstraintCompiler.compile("r", Map.of("action.amount", nullMax)));
        }

        @Test
        @DisplayName("null constraint value → configuration error")
        void nullValue() {
            Map<String, Object> raw = new HashMap<>();
            raw.put("p", null);
            assertThrows(PolicyConfigurationException.class, () -> ConstraintCompiler.compile("r", raw));
        }

        @Test
        @DisplayName("null constraint map → no constraints")
        void nullMap() {
            assertTrue(ConstraintCompiler.compile("r", null).isEmpty());
        }
    }
}
