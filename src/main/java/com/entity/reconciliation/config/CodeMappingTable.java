package com.entity.reconciliation.config;

import com.entity.reconciliation.core.model.SourceSide;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Named lookup tables translating source-specific codes to standard values.
 * Lookups are case-insensitive on the source code.
 */
public final class CodeMappingTable {

    private static final CodeMappingTable EMPTY = new CodeMappingTable(Map.of());

    private final Map<String, Map<SourceSide, Map<String, String>>> mappings;

    private CodeMappingTable(Map<String, Map<SourceSide, Map<String, String>>> mappings) {
        this.mappings = mappings;
    }

    public static CodeMappingTable empty() {
        return EMPTY;
    }

    /**
     * Translates a source code. Returns empty when the mapping or the code is unknown.
     */
    public Optional<String> lookup(String mappingName, SourceSide side, String sourceCode) {
        if (mappingName == null || sourceCode == null) {
            return Optional.empty();
        }
        Map<SourceSide, Map<String, String>> bySide = mappings.get(mappingName);
        if (bySide == null) {
            return Optional.empty();
        }
        Map<String, String> codes = bySide.get(side);
        if (codes == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(codes.get(sourceCode.trim().toUpperCase(Locale.ROOT)));
    }

    public boolean hasMapping(String mappingName) {
        return mappings.containsKey(mappingName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Map<SourceSide, Map<String, String>>> mappings = new HashMap<>();

        public Builder map(String mappingName, SourceSide side, String sourceCode, String standardValue) {
            mappings.computeIfAbsent(mappingName, k -> new EnumMap<>(SourceSide.class))
                    .computeIfAbsent(side, k -> new HashMap<>())
                    .put(sourceCode.trim().toUpperCase(Locale.ROOT), standardValue);
            return this;
        }

        public CodeMappingTable build() {
            Map<String, Map<SourceSide, Map<String, String>>> copy = new HashMap<>();
            mappings.forEach((name, bySide) -> {
                Map<SourceSide, Map<String, String>> sides = new EnumMap<>(SourceSide.class);
                bySide.forEach((side, codes) -> sides.put(side, Map.copyOf(codes)));
                copy.put(name, sides);
            });
            return new CodeMappingTable(Map.copyOf(copy));
        }
    }
}
