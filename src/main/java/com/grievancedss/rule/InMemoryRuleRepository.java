package com.grievancedss.rule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class InMemoryRuleRepository implements RuleRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRuleRepository.class);

    private volatile List<Rule> rules;

    public InMemoryRuleRepository(List<Rule> initialRules) {
        this.rules = validated(initialRules);
        log.info("Loaded {} rules", rules.size());
    }

    @Override
    public List<Rule> findAll() {
        return rules;
    }

    @Override
    public Optional<Rule> findById(String ruleId) {
        return rules.stream()
            .filter(r -> r.id().equals(ruleId))
            .findFirst();
    }

    @Override
    public List<Rule> findByTier(AuthorityTier tier) {
        return rules.stream()
            .filter(r -> r.authorityTier() == tier)
            .toList();
    }

    @Override
    public Map<AuthorityTier, Integer> tierSummary() {
        Map<AuthorityTier, Integer> counts = new EnumMap<>(AuthorityTier.class);
        for (AuthorityTier tier : AuthorityTier.values()) {
            counts.put(tier, 0);
        }
        for (Rule rule : rules) {
            counts.merge(rule.authorityTier(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public void replaceAll(List<Rule> newRules) {
        List<Rule> snapshot = validated(newRules);
        this.rules = snapshot;
        log.info("Rule set replaced: {} rules active", snapshot.size());
    }

    private static List<Rule> validated(List<Rule> candidates) {
        if (candidates == null) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        for (Rule rule : candidates) {
            if (rule == null) {
                throw new IllegalArgumentException("rule set contains a null rule");
            }
            if (!seen.add(rule.id())) {
                throw new IllegalArgumentException("duplicate rule id: " + rule.id());
            }
        }
        return candidates.stream()
            .sorted(Comparator.comparing(Rule::id))
            .toList();
    }
}
