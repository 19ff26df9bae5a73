package com.grievancedss.fairness;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Consistency assessment of one decision against prior similar decisions.
 * {@code similarCasesPreview} holds at most the configured preview size;
 * {@code similarCasesConsidered} counts all of them.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FairnessReport(
    double consistencyScore,
    double threshold,
    boolean meetsThreshold,
    boolean anomalyDetected,
    String anomalyReason,
    int similarCasesConsidered,
    List<SimilarCase> similarCasesPreview,
    Recommendation recommendation
) {

    public FairnessReport {
        similarCasesPreview = List.copyOf(similarCasesPreview);
    }
}
