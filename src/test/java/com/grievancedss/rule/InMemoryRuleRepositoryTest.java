package com.grievancedss.rule;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRuleRepositoryTest {

    @Test
    void referenceRules_loadWithoutDuplicates() {
        InMemoryRuleRepository repository = new InMemoryRuleRepository(ReferenceRules.defaults());
        assertEquals(ReferenceRules.defaults().size(), repository.findAll().size());
        assertTrue(repository.findById("UGC_Attendance_75Percent_Minimum").isPresent());
    }

    @Test
    void findAll_isOrderedById() {
        InMemoryRuleRepository repository = new InMemoryRuleRepository(List.of(
            rule("b", AuthorityTier.L1_NATIONAL), rule("a", AuthorityTier.L3_UNIVERSITY)));
        assertEquals(List.of("a", "b"), repository.findAll().stream().map(Rule::id).toList());
    }

    @Test
    void duplicateIds_areRejected() {
        List<Rule> rules = List.of(rule("dup", AuthorityTier.L1_NATIONAL), rule("dup", AuthorityTier.L3_UNIVERSITY));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> new InMemoryRuleRepository(rules));
        assertTrue(ex.getMessage().contains("dup"));
    }

    @Test
    void replaceAll_keepsPreviousSnapshotOnFailure() {
        InMemoryRuleRepository repository = new InMemoryRuleRepository(List.of(rule("a", AuthorityTier.L1_NATIONAL)));
        List<Rule> before = repository.findAll();

        assertThrows(IllegalArgumentException.class, () -> repository.replaceAll(List.of(
            rule("x", AuthorityTier.L1_NATIONAL), rule("x", AuthorityTier.L2_ACCREDITATION))));
        assertSame(before, repository.findAll());

        repository.replaceAll(List.of(rule("c", AuthorityTier.L2_ACCREDITATION)));
        assertEquals(1, repository.findAll().size());
        assertEquals(1, before.size(), "earlier snapshot must not change");
        assertEquals("a", before.get(0).id());
    }

    @Test
    void tierSummary_includesEmptyTiers() {
        InMemoryRuleRepository repository = new InMemoryRuleRepository(List.of(
            rule("a", AuthorityTier.L1_NATIONAL), rule("b", AuthorityTier.L1_NATIONAL)));
        Map<AuthorityTier, Integer> summary = repository.tierSummary();
        assertEquals(2, summary.get(AuthorityTier.L1_NATIONAL));
        assertEquals(0, summary.get(AuthorityTier.L2_ACCREDITATION));
        assertEquals(0, summary.get(AuthorityTier.L3_UNIVERSITY));
        assertEquals(2, repository.findByTier(AuthorityTier.L1_NATIONAL).size());
    }

    @Test
    void ruleConstruction_validatesRequiredAttributes() {
        assertThrows(IllegalArgumentException.class, () -> Rule.builder(" ")
            .tier(AuthorityTier.L1_NATIONAL).then(outcome()).build());
        assertThrows(IllegalArgumentException.class, () -> Rule.builder("r").then(outcome()).build());
        assertThrows(IllegalArgumentException.class, () -> Rule.builder("r")
            .tier(AuthorityTier.L1_NATIONAL).salience(-1).then(outcome()).build());
        assertThrows(IllegalArgumentException.class, () -> Rule.builder("r")
            .tier(AuthorityTier.L1_NATIONAL).build());
    }

    @Test
    void authorityTier_parsesWireValuesAndNames() {
        assertEquals(AuthorityTier.L2_ACCREDITATION, AuthorityTier.fromValue("L2_Accreditation"));
        assertEquals(AuthorityTier.L3_UNIVERSITY, AuthorityTier.fromValue("l3_university"));
        assertThrows(IllegalArgumentException.class, () -> AuthorityTier.fromValue("L4_Department"));
        assertTrue(AuthorityTier.L1_NATIONAL.outranks(AuthorityTier.L3_UNIVERSITY));
        assertFalse(AuthorityTier.L3_UNIVERSITY.outranks(AuthorityTier.L2_ACCREDITATION));
    }

    // ---- helpers ----

    private static Rule rule(String id, AuthorityTier tier) {
        return Rule.builder(id).tier(tier).salience(100).then(outcome()).build();
    }

    private static RuleOutcome outcome() {
        return RuleOutcome.of(DecisionOutcome.ACCEPT, "ok", "test source");
    }
}
