package com.grievancedss.rule;

/**
 * Renders a rule's outcome from the facts that made it fire.
 * Implementations must be deterministic and must not call external systems.
 */
@FunctionalInterface
public interface OutcomeTemplate {

    RuleOutcome render(GrievanceFacts facts);

    static OutcomeTemplate fixed(RuleOutcome outcome) {
        return facts -> outcome;
    }
}
