package com.entity.reconciliation.quality;

import com.entity.reconciliation.core.model.MergedRecord;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scores merged attributes against weighted quality rules.
 * The score is the sum of the weights of passing rules, capped at 100. Each failing
 * rule adds one issue tag, {@code "Missing <label>"} when the value is absent and
 * {@code "Invalid <label>"} when it is present but fails the check, in rule order.
 * Never throws on missing or malformed values.
 */
public class DataQualityScorer {

    public static final int MAX_SCORE = 100;

    public QualityResult score(MergedRecord record, List<QualityRule> rules) {
        return score(record.attributes(), rules);
    }

    public QualityResult score(Map<String, Object> attributes, List<QualityRule> rules) {
        int score = 0;
        List<String> issues = new ArrayList<>();
        for (QualityRule rule : rules) {
            String issue = evaluate(rule, attributes);
            if (issue == null) {
                score += rule.weight();
            } else {
                issues.add(issue);
            }
        }
        return new QualityResult(Math.min(score, MAX_SCORE), issues);
    }

    /**
     * Returns null when the rule passes, otherwise the issue tag.
     */
    private String evaluate(QualityRule rule, Map<String, Object> attributes) {
        if (rule.validator() == ValidatorType.ANY_OF) {
            boolean anyPresent = rule.anyOfFields().stream()
                    .anyMatch(field -> isPresent(attributes.get(field)));
            return anyPresent ? null : missing(rule);
        }

        Object value = attributes.get(rule.field());
        if (!isPresent(value)) {
            return missing(rule);
        }
        boolean valid = switch (rule.validator()) {
            case NOT_NULL -> true;
            case RANGE -> inRange(value, rule);
            case PATTERN -> rule.pattern().matcher(value.toString()).matches();
            case ONE_OF -> rule.allowedValues().contains(value.toString());
            case ANY_OF -> throw new IllegalStateException("ANY_OF handled above");
        };
        return valid ? null : "Invalid " + rule.label();
    }

    private boolean inRange(Object value, QualityRule rule) {
        BigDecimal number = toDecimal(value);
        if (number == null) {
            return false;
        }
        if (rule.min() != null && number.compareTo(rule.min()) < 0) {
            return false;
        }
        return rule.max() == null || number.compareTo(rule.max()) <= 0;
    }

    private BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Long || value instanceof Integer) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isPresent(Object value) {
        return value != null && !(value instanceof String s && s.isBlank());
    }

    private static String missing(QualityRule rule) {
        return "Missing " + rule.label();
    }
}
