package com.entity.reconciliation.core.hash;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Deterministic hashing helpers used for change detection and tie-breaking.
 * Null values render as the empty string and values are joined with {@code '|'}.
 */
public final class Fingerprints {

    public static final String SEPARATOR = "|";

    private Fingerprints() {
    }

    /**
     * Computes the lowercase hex MD5 of the given values joined by {@code '|'}, in order.
     */
    public static String fingerprint(List<?> values) {
        String joined = values.stream()
                .map(Fingerprints::render)
                .collect(Collectors.joining(SEPARATOR));
        return md5Hex(joined);
    }

    /**
     * Digest of a full attribute map, independent of map iteration order.
     */
    public static String attributeDigest(Map<String, ?> attributes) {
        StringBuilder sb = new StringBuilder();
        new TreeMap<>(attributes).forEach((key, value) ->
                sb.append(key).append('=').append(render(value)).append(SEPARATOR));
        return md5Hex(sb.toString());
    }

    /**
     * Canonical string form of an attribute value; {@code null} becomes the empty string.
     */
    public static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    public static String md5Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
