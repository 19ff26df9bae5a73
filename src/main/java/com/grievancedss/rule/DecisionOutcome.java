package com.grievancedss.rule;

public enum DecisionOutcome {
    ACCEPT,
    REJECT,
    PARTIAL_ACCEPT,
    PENDING_CLARIFICATION
}
