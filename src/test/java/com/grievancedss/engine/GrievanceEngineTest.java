package com.grievancedss.engine;

import com.grievancedss.evaluation.Firing;
import com.grievancedss.evaluation.RuleEvaluator;
import com.grievancedss.resolution.Conflict;
import com.grievancedss.resolution.ConflictKind;
import com.grievancedss.resolution.ConflictResolver;
import com.grievancedss.resolution.Decision;
import com.grievancedss.rule.AuthorityTier;
import com.grievancedss.rule.DecisionOutcome;
import com.grievancedss.rule.GrievanceFacts;
import com.grievancedss.rule.ReferenceRules;
import com.grievancedss.rule.Rule;
import com.grievancedss.trace.ConflictExplainer;
import com.grievancedss.trace.TraceBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GrievanceEngineTest {

    private final GrievanceEngine engine = new GrievanceEngine(
        new RuleEvaluator(), new ConflictResolver(), new TraceBuilder(), new ConflictExplainer());

    private final List<Rule> rules = ReferenceRules.defaults();

    @Nested
    @DisplayName("Attendance shortage")
    class Attendance {

        @Test
        void universityMedicalExcuse_overriddenByNationalMinimum() {
            Evaluation evaluation = evaluate(ReferenceRules.ATTENDANCE_SHORTAGE, Map.of(
                "attendance_percentage", 68.5,
                "has_medical_certificate", true));

            Decision decision = evaluation.decision();
            assertEquals(DecisionOutcome.REJECT, decision.outcome());
            assertEquals("UGC_Attendance_75Percent_Minimum", decision.applicableRuleId());
            assertEquals(AuthorityTier.L1_NATIONAL, decision.authorityTier());

            List<Conflict> conflicts = evaluation.trace().conflicts();
            assertEquals(1, conflicts.size());
            assertEquals(ConflictKind.AUTHORITY, conflicts.get(0).kind());
            assertEquals(List.of("UGC_Attendance_75Percent_Minimum", "University_Medical_Excuse_Attendance"),
                conflicts.get(0).conflictingRuleIds());
            assertTrue(evaluation.explanation().narrative().startsWith("Authority Conflict Detected"));
        }

        @Test
        void recognisedCertificate_nationalExceptionWinsOnSalience() {
            Evaluation evaluation = evaluate(ReferenceRules.ATTENDANCE_SHORTAGE, Map.of(
                "attendance_percentage", 68.5,
                "has_medical_certificate", true,
                "medical_certificate_from_recognized_authority", true));

            Decision decision = evaluation.decision();
            assertEquals(DecisionOutcome.ACCEPT, decision.outcome());
            assertEquals("UGC_Medical_Excuse_Exception", decision.applicableRuleId());
            assertEquals(1600, decision.salience());
            assertNotNull(decision.actionRequired());
            assertEquals("1 Authority, 1 Salience", evaluation.explanation().conflictBreakdown());
        }

        @Test
        void sufficientAttendance_acceptedWithoutConflict() {
            Evaluation evaluation = evaluate(ReferenceRules.ATTENDANCE_SHORTAGE, Map.of("attendance_percentage", 80));

            assertEquals(DecisionOutcome.ACCEPT, evaluation.decision().outcome());
            assertEquals("UGC_Attendance_Satisfied", evaluation.decision().applicableRuleId());
            assertTrue(evaluation.trace().conflicts().isEmpty());
        }
    }

    @Nested
    @DisplayName("Other grievance types")
    class OtherTypes {

        @Test
        void transcriptDelay_newerPolicyWinsTemporalConflict() {
            Evaluation evaluation = evaluate(ReferenceRules.TRANSCRIPT_DELAY, Map.of("delay_days", 35));

            assertEquals(DecisionOutcome.ACCEPT, evaluation.decision().outcome());
            assertEquals("University_Transcript_Delay_Compensation", evaluation.decision().applicableRuleId());
            assertEquals(ConflictKind.TEMPORAL, evaluation.trace().conflicts().get(0).kind());
        }

        @Test
        void unpaidRevaluationFee_pendingWithAction() {
            Evaluation evaluation = evaluate(ReferenceRules.EXAMINATION_REEVAL, Map.of(
                "days_since_result_declaration", 10,
                "revaluation_fee_paid", false));

            assertEquals(DecisionOutcome.PENDING_CLARIFICATION, evaluation.decision().outcome());
            assertEquals("University_Exam_Policy_Reeval_Fee", evaluation.decision().applicableRuleId());
            assertEquals("Pay revaluation fee", evaluation.decision().actionRequired());
        }

        @Test
        void scStudentBelowIncomeLimit_feeWaiverOverridesInstalmentPlan() {
            Evaluation evaluation = evaluate(ReferenceRules.FEE_WAIVER, Map.of(
                "student_category", "SC",
                "family_income", 150_000));

            assertEquals(DecisionOutcome.ACCEPT, evaluation.decision().outcome());
            assertEquals("Right_To_Education_Fee_Waiver_SC_ST", evaluation.decision().applicableRuleId());
            assertEquals(ConflictKind.AUTHORITY, evaluation.trace().conflicts().get(0).kind());
        }

        @Test
        void unknownType_defaultsToPendingClarification() {
            Evaluation evaluation = evaluate("HOSTEL_ALLOCATION", Map.of("room", "B-12"));

            Decision decision = evaluation.decision();
            assertEquals(DecisionOutcome.PENDING_CLARIFICATION, decision.outcome());
            assertEquals(Decision.NO_RULE_ID, decision.applicableRuleId());
            assertTrue(decision.humanReviewRequired());
            assertEquals(rules.size(), evaluation.trace().firings().size());
            assertEquals(0, evaluation.trace().firedCount());
            assertTrue(evaluation.explanation().narrative().startsWith("No rule was applicable"));
        }
    }

    @Test
    void repeatedEvaluation_isDeterministic() {
        Map<String, Object> params = Map.of(
            "attendance_percentage", 68.5,
            "has_medical_certificate", true,
            "medical_certificate_from_recognized_authority", true);

        Evaluation first = evaluate(ReferenceRules.ATTENDANCE_SHORTAGE, params);
        Evaluation second = evaluate(ReferenceRules.ATTENDANCE_SHORTAGE, params);

        assertEquals(first.trace().firings(), second.trace().firings());
        assertEquals(first.trace().conflicts(), second.trace().conflicts());
        assertEquals(first.decision(), second.decision());
        assertEquals(first.explanation(), second.explanation());
    }

    @Test
    void firingsAreRecordedInRuleIdOrder() {
        List<String> ids = evaluate(ReferenceRules.FEE_WAIVER, Map.of()).trace().firings().stream()
            .map(Firing::ruleId)
            .toList();

        assertEquals(ids.stream().sorted().toList(), ids);
    }

    @Test
    void reviewRequest_forcesHumanReviewOnly() {
        Evaluation evaluation = engine.evaluate(
            GrievanceFacts.of(ReferenceRules.TRANSCRIPT_DELAY, Map.of("delay_days", 35)), rules, true);

        assertEquals(DecisionOutcome.ACCEPT, evaluation.decision().outcome());
        assertTrue(evaluation.decision().humanReviewRequired());
        assertTrue(evaluation.explanation().finalDecisionContext().endsWith("Human Review Required: Yes"));
    }

    // ---- helpers ----

    private Evaluation evaluate(String type, Map<String, Object> params) {
        return engine.evaluate(GrievanceFacts.of(type, params), rules);
    }
}
