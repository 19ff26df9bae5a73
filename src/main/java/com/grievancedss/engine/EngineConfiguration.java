package com.grievancedss.engine;

import com.grievancedss.evaluation.RuleEvaluator;
import com.grievancedss.resolution.ConflictResolver;
import com.grievancedss.trace.ConflictExplainer;
import com.grievancedss.trace.TraceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfiguration {

    @Bean
    public GrievanceEngine grievanceEngine() {
        return new GrievanceEngine(
            new RuleEvaluator(),
            new ConflictResolver(),
            new TraceBuilder(),
            new ConflictExplainer()
        );
    }
}
