package com.grievancedss.trace;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.grievancedss.evaluation.Firing;
import com.grievancedss.resolution.Conflict;
import com.grievancedss.resolution.Decision;

import java.util.List;

/**
 * Audit record of one evaluation: every rule considered (in evaluation
 * order), every conflict and the final decision.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Trace(
    List<Firing> firings,
    List<Conflict> conflicts,
    Decision decision,
    long processingDurationMs
) {

    public Trace {
        firings = List.copyOf(firings);
        conflicts = List.copyOf(conflicts);
    }

    public long firedCount() {
        return firings.stream().filter(Firing::fired).count();
    }
}
