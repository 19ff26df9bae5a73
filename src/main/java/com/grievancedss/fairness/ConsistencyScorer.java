package com.grievancedss.fairness;

import com.grievancedss.resolution.Decision;
import com.grievancedss.rule.DecisionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Scores a decision against prior similar decisions.
 *
 * The score weighs agreement on outcome (0.5), applied rule (0.3) and
 * authority tier (0.2). A decision is anomalous when the score falls below
 * the threshold and its outcome also differs from the historical majority.
 * No comparison is possible without prior cases, so an empty history
 * scores 1.0.
 */
public class ConsistencyScorer {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyScorer.class);

    static final double OUTCOME_WEIGHT = 0.5;
    static final double RULE_WEIGHT = 0.3;
    static final double TIER_WEIGHT = 0.2;

    private final double threshold;
    private final double consistentBand;
    private final int previewSize;

    public ConsistencyScorer(FairnessProperties properties) {
        this.threshold = properties.consistencyThreshold();
        this.consistentBand = properties.consistentBand();
        this.previewSize = properties.previewSize();
    }

    public FairnessReport score(Decision decision, List<SimilarCase> similarCases) {
        List<SimilarCase> cases = similarCases == null ? List.of() : similarCases;
        List<SimilarCase> preview = cases.subList(0, Math.min(previewSize, cases.size()));

        if (cases.isEmpty()) {
            log.debug("No similar cases for rule {}; consistency not penalised", decision.applicableRuleId());
            return new FairnessReport(1.0, threshold, true, false, null, 0, preview, Recommendation.CONSISTENT);
        }

        double score = consistencyScore(decision, cases);
        String anomalyReason = anomalyReason(score, decision.outcome(), cases);
        boolean anomaly = anomalyReason != null;

        if (anomaly) {
            log.warn("Anomaly detected for rule {}: {}", decision.applicableRuleId(), anomalyReason);
        } else {
            log.debug("Consistency score {} over {} similar cases", score, cases.size());
        }

        return new FairnessReport(
            score,
            threshold,
            score >= threshold,
            anomaly,
            anomalyReason,
            cases.size(),
            preview,
            recommend(score, anomaly)
        );
    }

    double consistencyScore(Decision decision, List<SimilarCase> cases) {
        int total = cases.size();
        long outcomeMatches = cases.stream().filter(c -> c.outcome() == decision.outcome()).count();
        long ruleMatches = cases.stream()
            .filter(c -> Objects.equals(c.applicableRuleId(), decision.applicableRuleId()))
            .count();
        long tierMatches = cases.stream().filter(c -> c.authorityTier() == decision.authorityTier()).count();

        double raw = OUTCOME_WEIGHT * outcomeMatches / total
            + RULE_WEIGHT * ruleMatches / total
            + TIER_WEIGHT * tierMatches / total;

        double rounded = BigDecimal.valueOf(raw).setScale(4, RoundingMode.HALF_UP).doubleValue();
        return Math.min(1.0, Math.max(0.0, rounded));
    }

    private String anomalyReason(double score, DecisionOutcome current, List<SimilarCase> cases) {
        if (score >= threshold) {
            return null;
        }

        // LinkedHashMap keeps first-encountered order, so ties go to the earliest outcome
        Map<DecisionOutcome, Integer> counts = new LinkedHashMap<>();
        for (SimilarCase c : cases) {
            counts.merge(c.outcome(), 1, Integer::sum);
        }
        DecisionOutcome majority = null;
        int majorityCount = 0;
        for (Map.Entry<DecisionOutcome, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > majorityCount) {
                majority = entry.getKey();
                majorityCount = entry.getValue();
            }
        }

        if (current == majority) {
            return null;
        }
        return String.format(Locale.ROOT,
            "Decision outcome %s differs from most common outcome %s (%d/%d cases). "
                + "Consistency score: %.4f (threshold: %s)",
            current, majority, majorityCount, cases.size(), score, threshold);
    }

    private Recommendation recommend(double score, boolean anomaly) {
        if (anomaly) {
            return Recommendation.HUMAN_REVIEW_RECOMMENDED;
        }
        if (score < consistentBand) {
            return Recommendation.REVIEW_SUGGESTED;
        }
        return Recommendation.CONSISTENT;
    }
}
