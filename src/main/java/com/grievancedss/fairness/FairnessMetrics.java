package com.grievancedss.fairness;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Aggregate view over many fairness reports.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FairnessMetrics(
    int totalChecks,
    double averageConsistencyScore,
    int anomaliesDetected,
    double anomalyRate
) {

    public static FairnessMetrics of(List<FairnessReport> reports) {
        if (reports.isEmpty()) {
            return new FairnessMetrics(0, 0.0, 0, 0.0);
        }
        double average = reports.stream().mapToDouble(FairnessReport::consistencyScore).average().orElse(0.0);
        int anomalies = (int) reports.stream().filter(FairnessReport::anomalyDetected).count();
        return new FairnessMetrics(
            reports.size(),
            round(average),
            anomalies,
            round((double) anomalies / reports.size())
        );
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
