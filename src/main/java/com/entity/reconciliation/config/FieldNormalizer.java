package com.entity.reconciliation.config;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Per-field value normalizers applied to both sources before comparison.
 * Blank strings always normalize to {@code null}. Values that cannot be coerced to
 * the target type are kept as trimmed strings so quality checks can flag them.
 */
public enum FieldNormalizer {
    NONE {
        @Override
        Object normalizeText(String text) {
            return text;
        }
    },
    UPPER_TRIM {
        @Override
        Object normalizeText(String text) {
            return text.toUpperCase(Locale.ROOT);
        }
    },
    LOWER_TRIM {
        @Override
        Object normalizeText(String text) {
            return text.toLowerCase(Locale.ROOT);
        }
    },
    DIGITS_ONLY {
        @Override
        Object normalizeText(String text) {
            String digits = text.replaceAll("[^0-9]", "");
            return digits.isEmpty() ? null : digits;
        }
    },
    POSTAL_CODE {
        @Override
        Object normalizeText(String text) {
            String cleaned = text.replaceAll("[^0-9-]", "");
            return cleaned.isEmpty() ? null : cleaned;
        }
    },
    INTEGER {
        @Override
        Object normalizeValue(Object raw) {
            if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
                return ((Number) raw).longValue();
            }
            if (raw instanceof BigDecimal decimal) {
                return integralOrText(decimal);
            }
            if (raw instanceof Number number) {
                return integralOrText(BigDecimal.valueOf(number.doubleValue()));
            }
            return super.normalizeValue(raw);
        }

        @Override
        Object normalizeText(String text) {
            try {
                return integralOrText(new BigDecimal(text));
            } catch (NumberFormatException e) {
                return text;
            }
        }

        private Object integralOrText(BigDecimal decimal) {
            try {
                return decimal.longValueExact();
            } catch (ArithmeticException e) {
                return decimal.toPlainString();
            }
        }
    },
    DECIMAL {
        @Override
        Object normalizeValue(Object raw) {
            if (raw instanceof BigDecimal decimal) {
                return decimal.stripTrailingZeros();
            }
            if (raw instanceof Integer || raw instanceof Long) {
                return BigDecimal.valueOf(((Number) raw).longValue()).stripTrailingZeros();
            }
            if (raw instanceof Number number) {
                return BigDecimal.valueOf(number.doubleValue()).stripTrailingZeros();
            }
            return super.normalizeValue(raw);
        }

        @Override
        Object normalizeText(String text) {
            try {
                return new BigDecimal(text).stripTrailingZeros();
            } catch (NumberFormatException e) {
                return text;
            }
        }
    },
    BOOLEAN {
        @Override
        Object normalizeValue(Object raw) {
            if (raw instanceof Boolean) {
                return raw;
            }
            if (raw instanceof Number number) {
                return number.intValue() != 0;
            }
            return super.normalizeValue(raw);
        }

        @Override
        Object normalizeText(String text) {
            return switch (text.toUpperCase(Locale.ROOT)) {
                case "TRUE", "T", "Y", "YES", "1" -> Boolean.TRUE;
                case "FALSE", "F", "N", "NO", "0" -> Boolean.FALSE;
                default -> text;
            };
        }
    },
    DATE {
        @Override
        Object normalizeValue(Object raw) {
            if (raw instanceof LocalDate) {
                return raw;
            }
            return super.normalizeValue(raw);
        }

        @Override
        Object normalizeText(String text) {
            String datePart = text.length() > 10 && text.charAt(10) == 'T' ? text.substring(0, 10) : text;
            try {
                return LocalDate.parse(datePart);
            } catch (DateTimeParseException e) {
                return text;
            }
        }
    };

    /**
     * Normalizes a raw source value. Returns {@code null} for null or blank input.
     */
    public Object normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        return normalizeValue(raw);
    }

    Object normalizeValue(Object raw) {
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        return normalizeText(text);
    }

    abstract Object normalizeText(String text);
}
