package com.grievancedss.rule;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Factory for the built-in condition kinds used by the rule catalogue.
 */
public final class Conditions {

    private Conditions() {
    }

    public static Condition grievanceType(String type) {
        return new TypeIs(type);
    }

    public static Condition lessThan(String key, double threshold) {
        return new Compare(key, Operator.LT, threshold);
    }

    public static Condition atMost(String key, double threshold) {
        return new Compare(key, Operator.LE, threshold);
    }

    public static Condition greaterThan(String key, double threshold) {
        return new Compare(key, Operator.GT, threshold);
    }

    public static Condition atLeast(String key, double threshold) {
        return new Compare(key, Operator.GE, threshold);
    }

    public static Condition isTrue(String key) {
        return new Flag(key, true);
    }

    public static Condition isFalse(String key) {
        return new Flag(key, false);
    }

    public static Condition oneOf(String key, String... values) {
        return new OneOf(key, Arrays.stream(values)
            .map(v -> v.toUpperCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet()));
    }

    enum Operator {
        LT("<"), LE("<="), GT(">"), GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        boolean apply(double left, double right) {
            return switch (this) {
                case LT -> left < right;
                case LE -> left <= right;
                case GT -> left > right;
                case GE -> left >= right;
            };
        }
    }

    record TypeIs(String type) implements Condition {

        @Override
        public String expression() {
            return "type == '" + type + "'";
        }

        @Override
        public ConditionCheck check(GrievanceFacts facts) {
            String observed = facts.type();
            boolean satisfied = observed != null && observed.equalsIgnoreCase(type);
            return ConditionCheck.of(expression(), satisfied, observed);
        }
    }

    record Compare(String key, Operator operator, double threshold) implements Condition {

        @Override
        public String expression() {
            return key + " " + operator.symbol + " " + BigDecimal.valueOf(threshold).stripTrailingZeros().toPlainString();
        }

        @Override
        public ConditionCheck check(GrievanceFacts facts) {
            Object raw = facts.parameters().get(key);
            Double value = asNumber(raw);
            boolean satisfied = value != null && operator.apply(value, threshold);
            return ConditionCheck.of(expression(), satisfied, raw);
        }
    }

    record Flag(String key, boolean expected) implements Condition {

        @Override
        public String expression() {
            return key + " == " + expected;
        }

        @Override
        public ConditionCheck check(GrievanceFacts facts) {
            Object raw = facts.parameters().get(key);
            Boolean value = asBoolean(raw);
            boolean satisfied = value != null && value == expected;
            return ConditionCheck.of(expression(), satisfied, raw);
        }
    }

    record OneOf(String key, Set<String> allowed) implements Condition {

        @Override
        public String expression() {
            return key + " in " + allowed.stream().sorted().collect(Collectors.joining(", ", "[", "]"));
        }

        @Override
        public ConditionCheck check(GrievanceFacts facts) {
            Object raw = facts.parameters().get(key);
            boolean satisfied = raw != null && allowed.contains(String.valueOf(raw).toUpperCase(Locale.ROOT));
            return ConditionCheck.of(expression(), satisfied, raw);
        }
    }

    static Double asNumber(Object raw) {
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isNaN(value) ? null : value;
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    static Boolean asBoolean(Object raw) {
        if (raw instanceof Boolean flag) {
            return flag;
        }
        if (raw instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return Boolean.FALSE;
            }
        }
        return null;
    }
}
