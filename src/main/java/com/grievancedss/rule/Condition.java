package com.grievancedss.rule;

/**
 * One clause of a rule's applicability predicate.
 *
 * Implementations must be side-effect free and total: a missing or
 * malformed parameter yields an unsatisfied check, never an exception.
 */
public interface Condition {

    /** Display form of the clause, e.g. {@code attendance_percentage < 75}. */
    String expression();

    ConditionCheck check(GrievanceFacts facts);
}
