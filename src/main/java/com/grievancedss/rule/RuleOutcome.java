package com.grievancedss.rule;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * What a rule concludes when its conditions hold.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RuleOutcome(
    DecisionOutcome outcome,
    String reason,
    String regulatorySource,
    String actionRequired,
    boolean humanReviewRequired
) {

    public RuleOutcome {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome is required");
        }
    }

    public static RuleOutcome of(DecisionOutcome outcome, String reason, String regulatorySource) {
        return new RuleOutcome(outcome, reason, regulatorySource, null, false);
    }

    public RuleOutcome withActionRequired(String action) {
        return new RuleOutcome(outcome, reason, regulatorySource, action, humanReviewRequired);
    }

    public RuleOutcome withHumanReview() {
        return new RuleOutcome(outcome, reason, regulatorySource, actionRequired, true);
    }
}
