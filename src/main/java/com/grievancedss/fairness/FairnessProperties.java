package com.grievancedss.fairness;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables for consistency scoring, bound from {@code grievance.fairness.*}.
 *
 * @param consistencyThreshold score below which a diverging decision is an anomaly
 * @param consistentBand       score at or above which a decision is reported consistent
 * @param similarCaseLimit     prior decisions fetched per comparison
 * @param previewSize          prior decisions echoed in the report
 */
@ConfigurationProperties(prefix = "grievance.fairness")
public record FairnessProperties(
    @DefaultValue("0.85") double consistencyThreshold,
    @DefaultValue("0.90") double consistentBand,
    @DefaultValue("10") int similarCaseLimit,
    @DefaultValue("5") int previewSize
) {

    public FairnessProperties {
        if (consistencyThreshold < 0.0 || consistencyThreshold > 1.0) {
            throw new IllegalArgumentException("consistency-threshold must be within [0, 1]");
        }
        if (consistentBand < consistencyThreshold || consistentBand > 1.0) {
            throw new IllegalArgumentException("consistent-band must be within [consistency-threshold, 1]");
        }
        if (similarCaseLimit < 0 || previewSize < 0) {
            throw new IllegalArgumentException("similar-case-limit and preview-size must be non-negative");
        }
    }

    public static FairnessProperties defaults() {
        return new FairnessProperties(0.85, 0.90, 10, 5);
    }
}
