package com.grievancedss.trace;

import com.grievancedss.resolution.Conflict;
import com.grievancedss.resolution.ConflictKind;
import com.grievancedss.resolution.Decision;
import com.grievancedss.rule.AuthorityTier;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the resolver's conflicts and decision as narrative text. Pure
 * presentation: it neither re-ranks rules nor modifies the decision.
 */
public class ConflictExplainer {

    static final String NOT_APPLICABLE = "N/A";

    private static final String HIERARCHY_LINE =
        "L1 (National Laws/UGC Regulations) > L2 (Accreditation Standards/NAAC/NBA/AICTE) > L3 (University Statutes)";

    /** Explains a complete trace; uses the fired-rule count to word the no-conflict case. */
    public Explanation explain(Trace trace) {
        return render(trace.conflicts(), trace.decision(), trace.firedCount());
    }

    public Explanation explain(List<Conflict> conflicts, Decision decision) {
        return render(conflicts == null ? List.of() : conflicts, decision, -1);
    }

    private Explanation render(List<Conflict> conflicts, Decision decision, long firedCount) {
        String context = finalDecisionContext(decision, conflicts.size());

        if (conflicts.isEmpty()) {
            return new Explanation(
                "No conflicts detected",
                noConflictNarrative(decision, firedCount),
                context,
                NOT_APPLICABLE,
                0,
                breakdown(conflicts)
            );
        }

        String narrative = conflicts.stream()
            .map(this::explainConflict)
            .collect(Collectors.joining("\n\n"));

        return new Explanation(
            conflicts.size() + " conflict(s) detected and resolved",
            narrative,
            context,
            conflicts.get(0).resolutionStrategy(),
            conflicts.size(),
            breakdown(conflicts)
        );
    }

    private String noConflictNarrative(Decision decision, long firedCount) {
        if (Decision.NO_RULE_ID.equals(decision.applicableRuleId())) {
            return "No rule was applicable to this grievance. The decision is pending clarification "
                + "and has been routed for human review.";
        }
        if (firedCount > 1) {
            return firedCount + " rules applied to this grievance and all agreed on the outcome "
                + decision.outcome() + ". The decision is attributed to '" + decision.applicableRuleId()
                + "' (" + decision.authorityTier().getValue() + "), the highest-precedence of them.";
        }
        if (firedCount == 1) {
            return "Only one rule was applicable to this grievance: '" + decision.applicableRuleId()
                + "' (" + decision.authorityTier().getValue() + ").";
        }
        return "Only one rule, or only rules agreeing on the outcome " + decision.outcome()
            + ", applied to this grievance. The decision is attributed to '"
            + decision.applicableRuleId() + "' (" + decision.authorityTier().getValue() + ").";
    }

    private String explainConflict(Conflict conflict) {
        if (conflict.isAuthoringDefect()) {
            return genericConflict(conflict);
        }
        return switch (conflict.kind()) {
            case AUTHORITY -> authorityConflict(conflict);
            case SALIENCE -> salienceConflict(conflict);
            case TEMPORAL -> temporalConflict(conflict);
        };
    }

    private String authorityConflict(Conflict conflict) {
        return "Authority Conflict Detected\n\n"
            + "Conflicting Rules:\n" + ruleList(conflict) + "\n\n"
            + "Resolution:\n"
            + "The rule '" + conflict.winningRuleId() + "' was selected based on the established regulatory hierarchy:\n"
            + "- " + HIERARCHY_LINE + "\n\n"
            + "Rationale:\n" + conflict.reason() + ". "
            + "National regulations supersede accreditation body guidelines, which in turn supersede "
            + "university-level policies, so a rule from a higher authority tier prevails regardless of "
            + "the salience or effective date of lower-tier rules.\n\n"
            + "Resolution Strategy: " + conflict.resolutionStrategy();
    }

    private String salienceConflict(Conflict conflict) {
        return "Salience Conflict Detected\n\n"
            + "Conflicting Rules (same hierarchy level):\n" + ruleList(conflict) + "\n\n"
            + "Resolution:\n"
            + "The rule '" + conflict.winningRuleId() + "' was selected based on its higher salience (priority score).\n\n"
            + "Rationale:\n" + conflict.reason() + ". "
            + "Within one authority tier the rule with the higher priority score prevails. Higher salience "
            + "is assigned to exception rules over general rules, specific conditions over broad ones and "
            + "mandatory provisions over discretionary ones.\n\n"
            + "Resolution Strategy: " + conflict.resolutionStrategy();
    }

    private String temporalConflict(Conflict conflict) {
        return "Temporal Conflict Detected\n\n"
            + "Conflicting Rules (different effective dates):\n" + ruleList(conflict) + "\n\n"
            + "Resolution:\n"
            + "The rule '" + conflict.winningRuleId() + "' was selected based on effective date precedence.\n\n"
            + "Rationale:\n" + conflict.reason() + ". "
            + "When a regulation is amended or superseded, the most recent provision takes precedence "
            + "unless explicitly stated otherwise.\n\n"
            + "Resolution Strategy: " + conflict.resolutionStrategy();
    }

    private String genericConflict(Conflict conflict) {
        return "Conflict Detected\n\n"
            + "Conflicting Rules:\n" + ruleList(conflict) + "\n\n"
            + "Resolution:\n"
            + "The rule '" + conflict.winningRuleId() + "' was selected.\n\n"
            + "Rationale:\n" + conflict.reason() + ". "
            + "The rules could not be ordered by authority, priority score or recency, so the rule "
            + "identifier ordering was applied. The rule set should be corrected.\n\n"
            + "Resolution Strategy: " + conflict.resolutionStrategy();
    }

    private String ruleList(Conflict conflict) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < conflict.conflictingRuleIds().size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            AuthorityTier tier = conflict.conflictingTiers().get(i);
            sb.append("- ").append(conflict.conflictingRuleIds().get(i))
                .append(" (").append(tier.getValue()).append(')');
        }
        return sb.toString();
    }

    private String finalDecisionContext(Decision decision, int conflictCount) {
        StringBuilder sb = new StringBuilder()
            .append("Final Decision: ").append(decision.outcome()).append('\n')
            .append("Applicable Rule: ").append(decision.applicableRuleId()).append('\n')
            .append("Hierarchy Level: ").append(decision.authorityTier().getValue()).append('\n')
            .append("Regulatory Source: ").append(decision.regulatorySource()).append('\n');
        if (conflictCount > 0) {
            sb.append("After resolving ").append(conflictCount)
                .append(" conflict(s), this decision rests on the highest-precedence applicable rule, from the ")
                .append(decision.authorityTier().getDisplayName().toLowerCase(Locale.ROOT))
                .append(" tier.\n");
        }
        sb.append("Human Review Required: ").append(decision.humanReviewRequired() ? "Yes" : "No");
        return sb.toString();
    }

    static String breakdown(List<Conflict> conflicts) {
        if (conflicts.isEmpty()) {
            return "No conflicts";
        }
        Map<ConflictKind, Long> counts = new EnumMap<>(ConflictKind.class);
        for (Conflict conflict : conflicts) {
            counts.merge(conflict.kind(), 1L, Long::sum);
        }
        return counts.entrySet().stream()
            .map(e -> e.getValue() + " " + capitalize(e.getKey().name()))
            .collect(Collectors.joining(", "));
    }

    private static String capitalize(String name) {
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }
}
