package com.grievancedss.engine;

import com.grievancedss.evaluation.Firing;
import com.grievancedss.evaluation.RuleEvaluator;
import com.grievancedss.resolution.ConflictResolver;
import com.grievancedss.resolution.Resolution;
import com.grievancedss.rule.GrievanceFacts;
import com.grievancedss.rule.Rule;
import com.grievancedss.trace.ConflictExplainer;
import com.grievancedss.trace.Explanation;
import com.grievancedss.trace.Trace;
import com.grievancedss.trace.TraceBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Evaluation pipeline: rules are matched against the facts, the firings are
 * resolved to one decision, and the outcome is recorded as a trace plus a
 * narrative explanation.
 *
 * Stateless: the rule set is passed per call, so one instance may serve
 * concurrent evaluations and a rule reload never affects a call in flight.
 */
public class GrievanceEngine {

    private static final Logger log = LoggerFactory.getLogger(GrievanceEngine.class);

    private final RuleEvaluator evaluator;
    private final ConflictResolver resolver;
    private final TraceBuilder traceBuilder;
    private final ConflictExplainer explainer;

    public GrievanceEngine(RuleEvaluator evaluator,
                           ConflictResolver resolver,
                           TraceBuilder traceBuilder,
                           ConflictExplainer explainer) {
        this.evaluator = evaluator;
        this.resolver = resolver;
        this.traceBuilder = traceBuilder;
        this.explainer = explainer;
    }

    public Evaluation evaluate(GrievanceFacts facts, List<Rule> rules) {
        return evaluate(facts, rules, false);
    }

    /**
     * @param reviewRequested set by an upstream ambiguity check; forces
     *                        human review on the decision without vetoing it
     */
    public Evaluation evaluate(GrievanceFacts facts, List<Rule> rules, boolean reviewRequested) {
        long start = System.nanoTime();

        List<Firing> firings = evaluator.evaluate(facts, rules);
        Resolution resolution = resolver.resolve(firings, reviewRequested);

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        Trace trace = traceBuilder.build(firings, resolution.conflicts(), resolution.decision(), elapsedMs);
        Explanation explanation = explainer.explain(trace);

        log.info("Evaluated type={} against {} rules: outcome={} rule={} conflicts={} ({} ms)",
            facts.type(), firings.size(), trace.decision().outcome(),
            trace.decision().applicableRuleId(), trace.conflicts().size(), elapsedMs);
        return new Evaluation(trace, explanation);
    }
}
