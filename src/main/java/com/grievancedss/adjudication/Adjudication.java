package com.grievancedss.adjudication;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.grievancedss.fairness.FairnessReport;
import com.grievancedss.resolution.Decision;
import com.grievancedss.trace.Explanation;
import com.grievancedss.trace.Trace;

import java.time.Instant;
import java.util.Map;

/**
 * Everything produced for one grievance: the trace (with its decision), the
 * explanation and the fairness report.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Adjudication(
    String grievanceId,
    String studentId,
    String grievanceType,
    String narrative,
    Map<String, Object> parameters,
    Instant decidedAt,
    Trace trace,
    Explanation explanation,
    FairnessReport fairness
) {

    public Decision decision() {
        return trace.decision();
    }
}
