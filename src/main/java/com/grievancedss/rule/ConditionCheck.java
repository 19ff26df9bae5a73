package com.grievancedss.rule;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of checking a single condition against a grievance.
 * {@code observedValue} is null when the referenced parameter was absent.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConditionCheck(
    String expression,
    boolean satisfied,
    Object observedValue,
    @JsonInclude(JsonInclude.Include.NON_NULL) String error
) {

    public static ConditionCheck of(String expression, boolean satisfied, Object observedValue) {
        return new ConditionCheck(expression, satisfied, observedValue, null);
    }

    public static ConditionCheck failed(String expression, String error) {
        return new ConditionCheck(expression, false, null, error);
    }
}
