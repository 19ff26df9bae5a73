package com.grievancedss.resolution;

import java.util.List;

public record Resolution(Decision decision, List<Conflict> conflicts) {

    public Resolution {
        conflicts = List.copyOf(conflicts);
    }
}
