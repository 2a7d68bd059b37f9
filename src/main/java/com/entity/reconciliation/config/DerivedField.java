package com.entity.reconciliation.config;

import java.util.List;
import java.util.Objects;

/**
 * A merged attribute computed from already-resolved fields.
 * Derived fields are evaluated in declaration order after all source fields are resolved.
 *
 * @param name         target attribute name
 * @param kind         derivation
 * @param inputs       resolved field names the derivation reads
 * @param defaultValue constant used by {@link Kind#DEFAULT}
 */
public record DerivedField(String name, Kind kind, List<String> inputs, String defaultValue) {

    public enum Kind {
        /**
         * {@code "LAST, FIRST M."} from inputs [first, middle, last] or [first, last].
         * Null when first or last is missing.
         */
        FULL_NAME,

        /**
         * Comma-joined non-null address parts; inputs [line1, line2, city, state, zip].
         * State and zip are joined by a space.
         */
        FULL_ADDRESS,

        /**
         * Fills the target with {@code defaultValue} when it resolved to null.
         */
        DEFAULT
    }

    public DerivedField {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(kind, "kind is required");
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        if (kind == Kind.FULL_NAME && (inputs.size() < 2 || inputs.size() > 3)) {
            throw new IllegalArgumentException("FULL_NAME needs [first, last] or [first, middle, last] inputs");
        }
        if (kind == Kind.FULL_ADDRESS && inputs.isEmpty()) {
            throw new IllegalArgumentException("FULL_ADDRESS needs at least one input");
        }
        if (kind == Kind.DEFAULT && defaultValue == null) {
            throw new IllegalArgumentException("DEFAULT needs a defaultValue for " + name);
        }
    }

    public static DerivedField fullName(String name, String... inputs) {
        return new DerivedField(name, Kind.FULL_NAME, List.of(inputs), null);
    }

    public static DerivedField fullAddress(String name, String... inputs) {
        return new DerivedField(name, Kind.FULL_ADDRESS, List.of(inputs), null);
    }

    public static DerivedField defaultValue(String name, String value) {
        return new DerivedField(name, Kind.DEFAULT, List.of(), value);
    }
}
