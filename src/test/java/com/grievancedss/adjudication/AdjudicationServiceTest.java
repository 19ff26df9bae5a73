package com.grievancedss.adjudication;

import com.grievancedss.engine.GrievanceEngine;
import com.grievancedss.evaluation.RuleEvaluator;
import com.grievancedss.fairness.ConsistencyScorer;
import com.grievancedss.fairness.FairnessMetrics;
import com.grievancedss.fairness.FairnessProperties;
import com.grievancedss.fairness.Recommendation;
import com.grievancedss.resolution.ConflictResolver;
import com.grievancedss.rule.DecisionOutcome;
import com.grievancedss.rule.InMemoryRuleRepository;
import com.grievancedss.rule.ReferenceRules;
import com.grievancedss.store.InMemoryDecisionStore;
import com.grievancedss.trace.ConflictExplainer;
import com.grievancedss.trace.TraceBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AdjudicationServiceTest {

    private InMemoryDecisionStore store;
    private AdjudicationService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryDecisionStore();
        FairnessProperties properties = FairnessProperties.defaults();
        service = new AdjudicationService(
            new InMemoryRuleRepository(ReferenceRules.defaults()),
            new GrievanceEngine(new RuleEvaluator(), new ConflictResolver(), new TraceBuilder(), new ConflictExplainer()),
            new ConsistencyScorer(properties),
            store,
            properties);
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void missingType_isRejected() {
            InvalidGrievanceException ex = assertThrows(InvalidGrievanceException.class,
                () -> service.adjudicate(new GrievanceSubmission("s1", " ", null, Map.of(), null)));
            assertEquals("grievance_type is required", ex.getMessage());
            assertThrows(InvalidGrievanceException.class, () -> service.adjudicate(null));
            assertTrue(store.findAll().isEmpty());
        }

        @Test
        void missingParameters_stillProducesDecision() {
            Adjudication adjudication = service.adjudicate(
                new GrievanceSubmission("s1", ReferenceRules.ATTENDANCE_SHORTAGE, null, null, null));

            assertEquals(DecisionOutcome.PENDING_CLARIFICATION, adjudication.decision().outcome());
            assertTrue(adjudication.decision().humanReviewRequired());
        }
    }

    @Nested
    @DisplayName("Fairness against history")
    class History {

        @Test
        void firstDecision_hasNoHistory() {
            Adjudication adjudication = service.adjudicate(transcript(35));

            assertNotNull(adjudication.grievanceId());
            assertEquals(0, adjudication.fairness().similarCasesConsidered());
            assertEquals(1.0, adjudication.fairness().consistencyScore());
            assertTrue(store.findById(adjudication.grievanceId()).isPresent());
        }

        @Test
        void laterDecision_isComparedWithPriorOnesButNotItself() {
            service.adjudicate(transcript(35));
            service.adjudicate(transcript(40));
            Adjudication third = service.adjudicate(transcript(50));

            assertEquals(2, third.fairness().similarCasesConsidered());
            assertEquals(1.0, third.fairness().consistencyScore());
            assertEquals(Recommendation.CONSISTENT, third.fairness().recommendation());
        }

        @Test
        void divergingDecision_isFlaggedAsAnomaly() {
            for (int i = 0; i < 3; i++) {
                service.adjudicate(transcript(35));
            }
            Adjudication withinWindow = service.adjudicate(transcript(10));

            assertEquals(DecisionOutcome.REJECT, withinWindow.decision().outcome());
            assertTrue(withinWindow.fairness().anomalyDetected());
            assertEquals(Recommendation.HUMAN_REVIEW_RECOMMENDED, withinWindow.fairness().recommendation());

            FairnessMetrics metrics = service.fairnessMetrics();
            assertEquals(4, metrics.totalChecks());
            assertEquals(1, metrics.anomaliesDetected());
        }

        @Test
        void otherGrievanceTypes_areNotSimilar() {
            service.adjudicate(transcript(35));
            Adjudication fee = service.adjudicate(new GrievanceSubmission("s2", ReferenceRules.FEE_WAIVER, null,
                Map.of("student_category", "SC", "family_income", 100_000), null));

            assertEquals(0, fee.fairness().similarCasesConsidered());
        }
    }

    @Test
    void reviewRequest_isCarriedIntoDecision() {
        Adjudication adjudication = service.adjudicate(new GrievanceSubmission("s1",
            ReferenceRules.TRANSCRIPT_DELAY, null, Map.of("delay_days", 35), true));

        assertTrue(adjudication.decision().humanReviewRequired());
        assertEquals(DecisionOutcome.ACCEPT, adjudication.decision().outcome());
    }

    @Test
    void narrativeIsKeptWithTheRecord() {
        String narrative = "My transcript was requested five weeks ago and has not been issued.";
        Adjudication adjudication = service.adjudicate(new GrievanceSubmission("s7",
            ReferenceRules.TRANSCRIPT_DELAY, narrative, Map.of("delay_days", 35), null));

        assertEquals(narrative, adjudication.narrative());
        assertEquals(narrative, store.findById(adjudication.grievanceId()).orElseThrow().narrative());
    }

    @Test
    void findByStudent_listsOnlyThatStudentsGrievancesOldestFirst() {
        Adjudication first = service.adjudicate(transcript(35));
        service.adjudicate(new GrievanceSubmission("other", ReferenceRules.TRANSCRIPT_DELAY, null,
            Map.of("delay_days", 35), null));
        Adjudication second = service.adjudicate(new GrievanceSubmission("s-35", ReferenceRules.FEE_WAIVER, null,
            Map.of("student_category", "SC", "family_income", 100_000), null));

        assertEquals(List.of(first.grievanceId(), second.grievanceId()),
            service.findByStudent("s-35").stream().map(Adjudication::grievanceId).toList());
        assertTrue(service.findByStudent("nobody").isEmpty());
    }

    @Test
    void unknownGrievanceId_isEmpty() {
        assertTrue(service.findAdjudication("nope").isEmpty());
    }

    // ---- helpers ----

    private static GrievanceSubmission transcript(int delayDays) {
        return new GrievanceSubmission("s-" + delayDays, ReferenceRules.TRANSCRIPT_DELAY, null,
            Map.of("delay_days", delayDays), null);
    }
}
