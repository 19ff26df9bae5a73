package com.grievancedss.trace;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Human-readable account of how a decision was reached.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Explanation(
    String summary,
    String narrative,
    String finalDecisionContext,
    String resolutionStrategy,
    int conflictCount,
    String conflictBreakdown
) {
}
