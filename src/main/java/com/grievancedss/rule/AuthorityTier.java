package com.grievancedss.rule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Regulatory authority tiers. Declaration order is binding precedence:
 * L1 outranks L2, which outranks L3.
 */
public enum AuthorityTier {
    L1_NATIONAL("L1_National", "National Law"),
    L2_ACCREDITATION("L2_Accreditation", "Accreditation Standards"),
    L3_UNIVERSITY("L3_University", "University Policy");

    private final String value;
    private final String displayName;

    AuthorityTier(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** True if this tier binds more strongly than {@code other}. */
    public boolean outranks(AuthorityTier other) {
        return ordinal() < other.ordinal();
    }

    @JsonCreator
    public static AuthorityTier fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown authority tier: " + raw));
    }
}
