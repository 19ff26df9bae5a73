package com.grievancedss.adjudication;

import com.grievancedss.engine.Evaluation;
import com.grievancedss.engine.GrievanceEngine;
import com.grievancedss.fairness.ConsistencyScorer;
import com.grievancedss.fairness.FairnessMetrics;
import com.grievancedss.fairness.FairnessProperties;
import com.grievancedss.fairness.FairnessReport;
import com.grievancedss.fairness.SimilarCase;
import com.grievancedss.rule.GrievanceFacts;
import com.grievancedss.rule.Rule;
import com.grievancedss.rule.RuleRepository;
import com.grievancedss.store.DecisionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adjudicates a grievance end to end: takes a snapshot of the active rules,
 * runs the engine, scores the decision against prior decisions of the same
 * grievance type and records the result.
 *
 * Similar cases are fetched before the new decision is stored, so a
 * decision is never compared with itself.
 */
@Service
public class AdjudicationService {

    private static final Logger log = LoggerFactory.getLogger(AdjudicationService.class);

    private final RuleRepository ruleRepository;
    private final GrievanceEngine engine;
    private final ConsistencyScorer scorer;
    private final DecisionStore decisionStore;
    private final int similarCaseLimit;

    public AdjudicationService(RuleRepository ruleRepository,
                               GrievanceEngine engine,
                               ConsistencyScorer scorer,
                               DecisionStore decisionStore,
                               FairnessProperties fairnessProperties) {
        this.ruleRepository = ruleRepository;
        this.engine = engine;
        this.scorer = scorer;
        this.decisionStore = decisionStore;
        this.similarCaseLimit = fairnessProperties.similarCaseLimit();
    }

    public Adjudication adjudicate(GrievanceSubmission submission) {
        if (submission == null) {
            throw new InvalidGrievanceException("grievance submission is required");
        }
        if (submission.grievanceType() == null || submission.grievanceType().isBlank()) {
            throw new InvalidGrievanceException("grievance_type is required");
        }

        String grievanceId = UUID.randomUUID().toString();
        GrievanceFacts facts = GrievanceFacts.of(submission.grievanceType().trim(), submission.parameters());
        if (submission.reviewRequested()) {
            log.warn("Grievance {} flagged for human review by ambiguity check", grievanceId);
        }

        List<Rule> rules = ruleRepository.findAll();
        Evaluation evaluation = engine.evaluate(facts, rules, submission.reviewRequested());

        List<SimilarCase> similarCases = decisionStore.findSimilar(facts.type(), similarCaseLimit);
        FairnessReport fairness = scorer.score(evaluation.decision(), similarCases);

        Adjudication adjudication = new Adjudication(
            grievanceId,
            submission.studentId(),
            facts.type(),
            submission.narrative(),
            facts.parameters(),
            Instant.now(),
            evaluation.trace(),
            evaluation.explanation(),
            fairness
        );
        decisionStore.save(adjudication);

        log.info("Grievance {} adjudicated: outcome={} rule={} humanReview={} consistency={} anomaly={}",
            grievanceId, adjudication.decision().outcome(), adjudication.decision().applicableRuleId(),
            adjudication.decision().humanReviewRequired(), fairness.consistencyScore(), fairness.anomalyDetected());
        return adjudication;
    }

    public Optional<Adjudication> findAdjudication(String grievanceId) {
        return decisionStore.findById(grievanceId);
    }

    /** All adjudications filed by one student, oldest first. */
    public List<Adjudication> findByStudent(String studentId) {
        return decisionStore.findByStudent(studentId);
    }

    public FairnessMetrics fairnessMetrics() {
        return FairnessMetrics.of(decisionStore.findAll().stream()
            .map(Adjudication::fairness)
            .toList());
    }
}
