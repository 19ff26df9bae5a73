package com.grievancedss.rule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionsTest {

    @Nested
    @DisplayName("Numeric comparisons")
    class Numeric {

        @Test
        void lessThan_satisfiedBelowThreshold() {
            ConditionCheck check = Conditions.lessThan("attendance_percentage", 75)
                .check(facts(Map.of("attendance_percentage", 68.5)));
            assertTrue(check.satisfied());
            assertEquals(68.5, check.observedValue());
            assertEquals("attendance_percentage < 75", check.expression());
        }

        @Test
        void lessThan_notSatisfiedAtThreshold() {
            assertFalse(Conditions.lessThan("attendance_percentage", 75)
                .check(facts(Map.of("attendance_percentage", 75))).satisfied());
        }

        @Test
        void atLeast_acceptsNumericString() {
            ConditionCheck check = Conditions.atLeast("attendance_percentage", 65)
                .check(facts(Map.of("attendance_percentage", "70")));
            assertTrue(check.satisfied());
            assertEquals("70", check.observedValue());
        }

        @Test
        void missingKey_isUnsatisfiedWithNullObservedValue() {
            ConditionCheck check = Conditions.atMost("days_since_result_declaration", 15)
                .check(facts(Map.of()));
            assertFalse(check.satisfied());
            assertNull(check.observedValue());
            assertNull(check.error());
        }

        @Test
        void nullValue_isTreatedAsMissing() {
            Map<String, Object> params = new HashMap<>();
            params.put("family_income", null);
            assertFalse(Conditions.lessThan("family_income", 200_000).check(facts(params)).satisfied());
        }

        @Test
        void unparseableValue_isUnsatisfiedButRecorded() {
            ConditionCheck check = Conditions.greaterThan("delay_days", 30)
                .check(facts(Map.of("delay_days", "a month")));
            assertFalse(check.satisfied());
            assertEquals("a month", check.observedValue());
        }

        @Test
        void expression_dropsTrailingZeros() {
            assertEquals("family_income < 200000", Conditions.lessThan("family_income", 200_000).expression());
            assertEquals("gpa >= 7.5", Conditions.atLeast("gpa", 7.5).expression());
        }
    }

    @Nested
    @DisplayName("Flags, categories and type")
    class Categorical {

        @Test
        void isTrue_acceptsBooleanAndString() {
            Condition condition = Conditions.isTrue("has_medical_certificate");
            assertTrue(condition.check(facts(Map.of("has_medical_certificate", true))).satisfied());
            assertTrue(condition.check(facts(Map.of("has_medical_certificate", "TRUE"))).satisfied());
            assertFalse(condition.check(facts(Map.of("has_medical_certificate", "yes"))).satisfied());
        }

        @Test
        void isFalse_requiresExplicitFalse() {
            Condition condition = Conditions.isFalse("revaluation_fee_paid");
            assertTrue(condition.check(facts(Map.of("revaluation_fee_paid", false))).satisfied());
            assertFalse(condition.check(facts(Map.of())).satisfied());
        }

        @Test
        void oneOf_isCaseInsensitive() {
            Condition condition = Conditions.oneOf("student_category", "SC", "ST");
            assertTrue(condition.check(facts(Map.of("student_category", "st"))).satisfied());
            assertFalse(condition.check(facts(Map.of("student_category", "EWS"))).satisfied());
            assertEquals("student_category in [SC, ST]", condition.expression());
        }

        @Test
        void grievanceType_nullTypeNeverMatches() {
            ConditionCheck check = Conditions.grievanceType("FEE_WAIVER")
                .check(GrievanceFacts.of(null, Map.of()));
            assertFalse(check.satisfied());
            assertNull(check.observedValue());
        }
    }

    private static GrievanceFacts facts(Map<String, Object> parameters) {
        return GrievanceFacts.of("ATTENDANCE_SHORTAGE", parameters);
    }
}
