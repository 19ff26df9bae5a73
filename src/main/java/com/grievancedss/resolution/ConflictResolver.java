package com.grievancedss.resolution;

import com.grievancedss.evaluation.Firing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic resolver for fired rules.
 *
 * The decision always comes from the single strongest firing under
 * {@link RulePrecedence#ORDER}. Every pair of fired rules that disagree on
 * outcome is documented as a {@link Conflict}, classified by the first
 * precedence attribute that separates them; rules that agree are never
 * reported as conflicting. Total over any list of firings: never throws.
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    public Resolution resolve(List<Firing> firings) {
        return resolve(firings, false);
    }

    /**
     * @param firings all firings of one evaluation, fired or not
     * @param reviewRequested external ambiguity flag; marks the decision for
     *                        human review without changing its outcome
     */
    public Resolution resolve(List<Firing> firings, boolean reviewRequested) {
        List<Firing> fired = firings == null
            ? List.of()
            : firings.stream()
                .filter(Firing::fired)
                .sorted(RulePrecedence.ORDER)
                .toList();

        if (fired.isEmpty()) {
            return new Resolution(Decision.noApplicableRule(), List.of());
        }

        Firing winner = fired.get(0);
        Decision decision = Decision.from(winner, reviewRequested);
        if (fired.size() == 1) {
            return new Resolution(decision, List.of());
        }

        List<Conflict> conflicts = new ArrayList<>();
        for (int i = 0; i < fired.size(); i++) {
            for (int j = i + 1; j < fired.size(); j++) {
                Firing stronger = fired.get(i);
                Firing weaker = fired.get(j);
                if (stronger.outcomeValue() != weaker.outcomeValue()) {
                    conflicts.add(describe(stronger, weaker));
                }
            }
        }

        if (!conflicts.isEmpty()) {
            log.info("Resolved {} conflict(s) among {} fired rules; winner={} ({})",
                conflicts.size(), fired.size(), winner.ruleId(), winner.authorityTier().getValue());
        }
        return new Resolution(decision, conflicts);
    }

    private Conflict describe(Firing winner, Firing loser) {
        ConflictKind kind = RulePrecedence.classify(winner, loser);
        String strategy;
        String reason;

        switch (kind) {
            case AUTHORITY -> {
                strategy = Conflict.AUTHORITY_PRECEDENCE;
                reason = winner.authorityTier().getValue() + " supersedes "
                    + loser.authorityTier().getValue() + " based on authority precedence";
            }
            case SALIENCE -> {
                strategy = Conflict.SALIENCE_PRIORITY;
                reason = "Salience " + winner.salience() + " outranks " + loser.salience()
                    + " within " + winner.authorityTier().getValue();
            }
            default -> {
                if (RulePrecedence.sameDate(winner, loser)) {
                    strategy = Conflict.DETERMINISTIC_TIEBREAK;
                    reason = "Rules share tier " + winner.authorityTier().getValue()
                        + ", salience " + winner.salience()
                        + " and effective date " + formatDate(winner.effectiveDate())
                        + "; '" + winner.ruleId() + "' selected by rule id ordering";
                    log.warn("Rule authoring defect: {} and {} are indistinguishable by precedence "
                        + "but disagree ({} vs {})",
                        winner.ruleId(), loser.ruleId(), winner.outcomeValue(), loser.outcomeValue());
                } else {
                    strategy = Conflict.TEMPORAL_PRECEDENCE;
                    reason = "Effective date " + formatDate(winner.effectiveDate())
                        + " is more recent than " + formatDate(loser.effectiveDate())
                        + " within " + winner.authorityTier().getValue()
                        + " at salience " + winner.salience();
                }
            }
        }

        return new Conflict(
            kind,
            List.of(winner.ruleId(), loser.ruleId()),
            List.of(winner.authorityTier(), loser.authorityTier()),
            winner.ruleId(),
            strategy,
            reason
        );
    }

    private static String formatDate(LocalDate date) {
        return date == null ? "unspecified" : date.toString();
    }
}
