package com.grievancedss.evaluation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.grievancedss.rule.AuthorityTier;
import com.grievancedss.rule.ConditionCheck;
import com.grievancedss.rule.DecisionOutcome;
import com.grievancedss.rule.Rule;
import com.grievancedss.rule.RuleOutcome;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of testing one rule against one grievance. Recorded whether or not
 * the rule fired; {@code outcome} is present only when it did.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Firing(
    String ruleId,
    AuthorityTier authorityTier,
    int salience,
    LocalDate effectiveDate,
    boolean fired,
    List<ConditionCheck> conditionsChecked,
    @JsonInclude(JsonInclude.Include.NON_NULL) RuleOutcome outcome
) {

    public Firing {
        conditionsChecked = conditionsChecked == null ? List.of() : List.copyOf(conditionsChecked);
        if (fired && outcome == null) {
            throw new IllegalArgumentException("fired rule " + ruleId + " must carry an outcome");
        }
        if (!fired) {
            outcome = null;
        }
    }

    static Firing fired(Rule rule, List<ConditionCheck> checks, RuleOutcome outcome) {
        return new Firing(rule.id(), rule.authorityTier(), rule.salience(), rule.effectiveDate(),
            true, checks, outcome);
    }

    static Firing notFired(Rule rule, List<ConditionCheck> checks) {
        return new Firing(rule.id(), rule.authorityTier(), rule.salience(), rule.effectiveDate(),
            false, checks, null);
    }

    /** Outcome value, or null when the rule did not fire. */
    public DecisionOutcome outcomeValue() {
        return outcome == null ? null : outcome.outcome();
    }
}
