package com.grievancedss.fairness;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FairnessProperties.class)
public class FairnessConfiguration {

    @Bean
    public ConsistencyScorer consistencyScorer(FairnessProperties properties) {
        return new ConsistencyScorer(properties);
    }
}
