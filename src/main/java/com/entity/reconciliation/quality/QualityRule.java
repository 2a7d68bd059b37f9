package com.entity.reconciliation.quality;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A weighted data quality check on merged attributes.
 *
 * @param field         attribute checked (ignored for {@link ValidatorType#ANY_OF})
 * @param weight        points awarded when the check passes
 * @param validator     check type
 * @param label         human label used in issue tags, e.g. {@code "first name"}
 * @param min           lower bound for RANGE, inclusive
 * @param max           upper bound for RANGE, inclusive
 * @param pattern       regular expression for PATTERN
 * @param allowedValues allowed string forms for ONE_OF
 * @param anyOfFields   candidate fields for ANY_OF
 */
public record QualityRule(
        String field,
        int weight,
        ValidatorType validator,
        String label,
        BigDecimal min,
        BigDecimal max,
        Pattern pattern,
        Set<String> allowedValues,
        List<String> anyOfFields
) {
    public QualityRule {
        Objects.requireNonNull(validator, "validator is required");
        if (weight < 0) {
            throw new IllegalArgumentException("weight cannot be negative");
        }
        allowedValues = allowedValues != null ? Set.copyOf(allowedValues) : Set.of();
        anyOfFields = anyOfFields != null ? List.copyOf(anyOfFields) : List.of();
        switch (validator) {
            case ANY_OF -> {
                if (anyOfFields.isEmpty()) {
                    throw new IllegalArgumentException("ANY_OF rule needs at least one field");
                }
            }
            case RANGE -> {
                requireField(field);
                if (min == null && max == null) {
                    throw new IllegalArgumentException("RANGE rule on " + field + " needs min or max");
                }
            }
            case PATTERN -> {
                requireField(field);
                Objects.requireNonNull(pattern, "PATTERN rule needs a pattern");
            }
            case ONE_OF -> {
                requireField(field);
                if (allowedValues.isEmpty()) {
                    throw new IllegalArgumentException("ONE_OF rule on " + field + " needs allowed values");
                }
            }
            default -> requireField(field);
        }
        if (label == null || label.isBlank()) {
            label = field != null ? field.replace('_', ' ') : String.join(" or ", anyOfFields);
        }
    }

    private static void requireField(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Quality rule field is required");
        }
    }

    public static QualityRule notNull(String field, int weight, String label) {
        return new QualityRule(field, weight, ValidatorType.NOT_NULL, label, null, null, null, null, null);
    }

    public static QualityRule range(String field, int weight, String label, long min, long max) {
        return new QualityRule(field, weight, ValidatorType.RANGE, label,
                BigDecimal.valueOf(min), BigDecimal.valueOf(max), null, null, null);
    }

    public static QualityRule pattern(String field, int weight, String label, String regex) {
        return new QualityRule(field, weight, ValidatorType.PATTERN, label,
                null, null, Pattern.compile(regex), null, null);
    }

    public static QualityRule oneOf(String field, int weight, String label, Set<String> allowed) {
        return new QualityRule(field, weight, ValidatorType.ONE_OF, label, null, null, null, allowed, null);
    }

    public static QualityRule anyOf(List<String> fields, int weight, String label) {
        return new QualityRule(null, weight, ValidatorType.ANY_OF, label, null, null, null, null, fields);
    }
}
