package com.grievancedss.resolution;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.grievancedss.rule.AuthorityTier;

import java.util.List;

/**
 * Disagreement in outcome between fired rules. {@code conflictingRuleIds}
 * lists the winner first; {@code conflictingTiers} is parallel to it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Conflict(
    ConflictKind kind,
    List<String> conflictingRuleIds,
    List<AuthorityTier> conflictingTiers,
    String winningRuleId,
    String resolutionStrategy,
    String reason
) {

    public static final String AUTHORITY_PRECEDENCE = "Authority Precedence";
    public static final String SALIENCE_PRIORITY = "Salience-Based Priority";
    public static final String TEMPORAL_PRECEDENCE = "Temporal Precedence";
    public static final String DETERMINISTIC_TIEBREAK = "Deterministic Tiebreak (rule conflict)";

    public Conflict {
        conflictingRuleIds = List.copyOf(conflictingRuleIds);
        conflictingTiers = List.copyOf(conflictingTiers);
        if (conflictingRuleIds.size() < 2) {
            throw new IllegalArgumentException("a conflict involves at least two rules");
        }
        if (conflictingTiers.size() != conflictingRuleIds.size()) {
            throw new IllegalArgumentException("one tier is required per conflicting rule");
        }
    }

    /** True when the rules were indistinguishable by precedence and ranked by id. */
    @JsonIgnore
    public boolean isAuthoringDefect() {
        return DETERMINISTIC_TIEBREAK.equals(resolutionStrategy);
    }
}
