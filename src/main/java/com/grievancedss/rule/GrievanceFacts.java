package com.grievancedss.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Structured facts of one grievance: its type and an arbitrary parameter map.
 * Null values are allowed and read as absent.
 */
public record GrievanceFacts(String type, Map<String, Object> parameters) {

    public GrievanceFacts {
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static GrievanceFacts of(String type, Map<String, Object> parameters) {
        return new GrievanceFacts(type, parameters);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(parameters.get(key));
    }
}
