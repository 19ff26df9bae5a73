package com.grievancedss.fairness;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.grievancedss.rule.AuthorityTier;
import com.grievancedss.rule.DecisionOutcome;

/**
 * Summary of a prior decision used for consistency comparison.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SimilarCase(
    String grievanceId,
    DecisionOutcome outcome,
    String applicableRuleId,
    AuthorityTier authorityTier
) {

    public static SimilarCase of(DecisionOutcome outcome, String applicableRuleId, AuthorityTier authorityTier) {
        return new SimilarCase(null, outcome, applicableRuleId, authorityTier);
    }
}
