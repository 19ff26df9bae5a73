package com.grievancedss.engine;

import com.grievancedss.resolution.Decision;
import com.grievancedss.trace.Explanation;
import com.grievancedss.trace.Trace;

public record Evaluation(Trace trace, Explanation explanation) {

    public Decision decision() {
        return trace.decision();
    }
}
