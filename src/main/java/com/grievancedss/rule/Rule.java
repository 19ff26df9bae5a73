package com.grievancedss.rule;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One regulatory provision: identity, precedence attributes, an
 * applicability predicate (the conjunction of {@code conditions}) and the
 * outcome it concludes when applicable.
 *
 * {@code effectiveDate} may be null; such rules rank as oldest when a
 * temporal tie-break is needed.
 */
public record Rule(
    String id,
    AuthorityTier authorityTier,
    int salience,
    LocalDate effectiveDate,
    List<Condition> conditions,
    OutcomeTemplate outcomeTemplate,
    String description
) {

    public Rule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("rule id is required");
        }
        if (authorityTier == null) {
            throw new IllegalArgumentException("authority tier is required for rule " + id);
        }
        if (salience < 0) {
            throw new IllegalArgumentException("salience must be non-negative for rule " + id);
        }
        if (outcomeTemplate == null) {
            throw new IllegalArgumentException("outcome template is required for rule " + id);
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private AuthorityTier authorityTier;
        private int salience;
        private LocalDate effectiveDate;
        private final List<Condition> conditions = new ArrayList<>();
        private OutcomeTemplate outcomeTemplate;
        private String description;

        private Builder(String id) {
            this.id = id;
        }

        public Builder tier(AuthorityTier tier) {
            this.authorityTier = tier;
            return this;
        }

        public Builder salience(int salience) {
            this.salience = salience;
            return this;
        }

        public Builder effectiveDate(LocalDate date) {
            this.effectiveDate = date;
            return this;
        }

        public Builder effectiveDate(String isoDate) {
            this.effectiveDate = LocalDate.parse(isoDate);
            return this;
        }

        public Builder when(Condition condition) {
            this.conditions.add(condition);
            return this;
        }

        public Builder then(OutcomeTemplate template) {
            this.outcomeTemplate = template;
            return this;
        }

        public Builder then(RuleOutcome outcome) {
            this.outcomeTemplate = OutcomeTemplate.fixed(outcome);
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Rule build() {
            return new Rule(id, authorityTier, salience, effectiveDate, conditions, outcomeTemplate, description);
        }
    }
}
