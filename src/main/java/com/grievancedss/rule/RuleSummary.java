package com.grievancedss.rule;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only view of a rule for catalogue listings. Omits the predicate and
 * the outcome template, which are code.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RuleSummary(
    String ruleId,
    AuthorityTier authorityTier,
    int salience,
    LocalDate effectiveDate,
    List<String> conditions,
    String description
) {

    public static RuleSummary of(Rule rule) {
        return new RuleSummary(
            rule.id(),
            rule.authorityTier(),
            rule.salience(),
            rule.effectiveDate(),
            rule.conditions().stream().map(Condition::expression).toList(),
            rule.description()
        );
    }
}
