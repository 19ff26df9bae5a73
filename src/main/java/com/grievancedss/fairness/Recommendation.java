package com.grievancedss.fairness;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Recommendation {
    HUMAN_REVIEW_RECOMMENDED("human review recommended"),
    REVIEW_SUGGESTED("review suggested"),
    CONSISTENT("consistent");

    private final String label;

    Recommendation(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
