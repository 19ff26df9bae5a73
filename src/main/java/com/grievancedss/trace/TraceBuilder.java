package com.grievancedss.trace;

import com.grievancedss.evaluation.Firing;
import com.grievancedss.resolution.Conflict;
import com.grievancedss.resolution.Decision;

import java.util.List;

public class TraceBuilder {

    public Trace build(List<Firing> firings, List<Conflict> conflicts, Decision decision, long elapsedMs) {
        if (decision == null) {
            throw new IllegalArgumentException("decision is required to build a trace");
        }
        return new Trace(
            firings == null ? List.of() : firings,
            conflicts == null ? List.of() : conflicts,
            decision,
            Math.max(0L, elapsedMs)
        );
    }
}
