package com.grievancedss.resolution;

import com.grievancedss.evaluation.Firing;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * Total precedence order over firings, strongest first: authority tier
 * (L1 first), then salience descending, then effective date descending
 * (a missing date ranks oldest), then rule id ascending.
 */
public final class RulePrecedence {

    public static final Comparator<Firing> ORDER = Comparator
        .comparing(Firing::authorityTier)
        .thenComparing(Comparator.<Firing>comparingInt(Firing::salience).reversed())
        .thenComparing(Firing::effectiveDate, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
        .thenComparing(Firing::ruleId);

    private RulePrecedence() {
    }

    /** First attribute on which {@code winner} outranks {@code loser}. */
    static ConflictKind classify(Firing winner, Firing loser) {
        if (winner.authorityTier().outranks(loser.authorityTier())) {
            return ConflictKind.AUTHORITY;
        }
        if (winner.salience() != loser.salience()) {
            return ConflictKind.SALIENCE;
        }
        return ConflictKind.TEMPORAL;
    }

    static boolean sameDate(Firing a, Firing b) {
        return a.effectiveDate() == null
            ? b.effectiveDate() == null
            : a.effectiveDate().equals(b.effectiveDate());
    }
}
