package com.grievancedss.rule;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source of the active rule set. The returned lists are immutable
 * snapshots; a reload never affects an evaluation already in progress.
 */
public interface RuleRepository {

    List<Rule> findAll();

    Optional<Rule> findById(String ruleId);

    List<Rule> findByTier(AuthorityTier tier);

    /** Number of active rules per tier, every tier present. */
    Map<AuthorityTier, Integer> tierSummary();

    /**
     * Atomically replaces the active rule set.
     *
     * @throws IllegalArgumentException if two rules share an id
     */
    void replaceAll(List<Rule> rules);
}
