package com.grievancedss.rule;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RuleConfiguration {

    @Bean
    public RuleRepository ruleRepository() {
        return new InMemoryRuleRepository(ReferenceRules.defaults());
    }
}
