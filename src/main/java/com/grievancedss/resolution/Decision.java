package com.grievancedss.resolution;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.grievancedss.evaluation.Firing;
import com.grievancedss.rule.AuthorityTier;
import com.grievancedss.rule.DecisionOutcome;
import com.grievancedss.rule.RuleOutcome;

/**
 * The single outcome of one evaluation, attributed to one rule.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Decision(
    DecisionOutcome outcome,
    String applicableRuleId,
    AuthorityTier authorityTier,
    int salience,
    String reason,
    String regulatorySource,
    String actionRequired,
    boolean humanReviewRequired
) {

    public static final String NO_RULE_ID = "Default_Review_Required";
    public static final String NO_RULE_REASON = "no applicable rule matched";

    static Decision from(Firing winner, boolean reviewRequested) {
        RuleOutcome outcome = winner.outcome();
        return new Decision(
            outcome.outcome(),
            winner.ruleId(),
            winner.authorityTier(),
            winner.salience(),
            outcome.reason(),
            outcome.regulatorySource(),
            outcome.actionRequired(),
            outcome.humanReviewRequired() || reviewRequested
        );
    }

    /** Fallback when no rule fired: always routed to a human. */
    static Decision noApplicableRule() {
        return new Decision(
            DecisionOutcome.PENDING_CLARIFICATION,
            NO_RULE_ID,
            AuthorityTier.L3_UNIVERSITY,
            0,
            NO_RULE_REASON,
            "University General Rules",
            "Provide additional details",
            true
        );
    }
}
