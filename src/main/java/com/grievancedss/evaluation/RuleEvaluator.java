package com.grievancedss.evaluation;

import com.grievancedss.rule.Condition;
import com.grievancedss.rule.ConditionCheck;
import com.grievancedss.rule.GrievanceFacts;
import com.grievancedss.rule.Rule;
import com.grievancedss.rule.RuleOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Tests every candidate rule against a grievance and records one
 * {@link Firing} per rule, in ascending rule-id order.
 *
 * All conditions of a rule are checked, even after one fails, so the
 * trace can answer why a rule did not apply. A rule whose condition or
 * outcome template throws is recorded as not fired with the error
 * captured; it never aborts evaluation of the remaining rules.
 */
public class RuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    static final String TEMPLATE_EXPRESSION = "outcome template";

    public List<Firing> evaluate(String grievanceType, Map<String, Object> parameters, List<Rule> rules) {
        return evaluate(GrievanceFacts.of(grievanceType, parameters), rules);
    }

    public List<Firing> evaluate(GrievanceFacts facts, List<Rule> rules) {
        if (rules == null || rules.isEmpty()) {
            return List.of();
        }

        List<Rule> ordered = rules.stream()
            .sorted(Comparator.comparing(Rule::id))
            .toList();

        List<Firing> firings = new ArrayList<>(ordered.size());
        for (Rule rule : ordered) {
            firings.add(evaluateRule(rule, facts));
        }

        log.debug("Evaluated {} rules for type={}, {} fired",
            firings.size(), facts.type(), firings.stream().filter(Firing::fired).count());
        return List.copyOf(firings);
    }

    private Firing evaluateRule(Rule rule, GrievanceFacts facts) {
        List<ConditionCheck> checks = new ArrayList<>(rule.conditions().size());
        boolean applicable = true;

        for (Condition condition : rule.conditions()) {
            ConditionCheck check;
            try {
                check = condition.check(facts);
            } catch (RuntimeException ex) {
                log.warn("Rule {} condition '{}' failed: {}", rule.id(), safeExpression(condition), ex.toString());
                checks.add(ConditionCheck.failed(safeExpression(condition), describe(ex)));
                return Firing.notFired(rule, checks);
            }
            if (check == null) {
                check = ConditionCheck.failed(safeExpression(condition), "condition returned no result");
            }
            checks.add(check);
            applicable &= check.satisfied();
        }

        if (!applicable) {
            return Firing.notFired(rule, checks);
        }

        RuleOutcome outcome;
        try {
            outcome = rule.outcomeTemplate().render(facts);
        } catch (RuntimeException ex) {
            log.warn("Rule {} outcome template failed: {}", rule.id(), ex.toString());
            checks.add(ConditionCheck.failed(TEMPLATE_EXPRESSION, describe(ex)));
            return Firing.notFired(rule, checks);
        }
        if (outcome == null) {
            log.warn("Rule {} outcome template produced no outcome", rule.id());
            checks.add(ConditionCheck.failed(TEMPLATE_EXPRESSION, "template produced no outcome"));
            return Firing.notFired(rule, checks);
        }
        return Firing.fired(rule, checks, outcome);
    }

    private static String safeExpression(Condition condition) {
        try {
            return condition.expression();
        } catch (RuntimeException ex) {
            return condition.getClass().getSimpleName();
        }
    }

    private static String describe(RuntimeException ex) {
        return ex.getMessage() != null
            ? ex.getClass().getSimpleName() + ": " + ex.getMessage()
            : ex.getClass().getSimpleName();
    }
}
