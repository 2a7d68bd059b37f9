package com.entity.reconciliation.merge;

import com.entity.reconciliation.config.DerivedField;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes derived attributes on top of resolved fields, in declaration order.
 */
class DerivedFieldCalculator {

    void apply(List<DerivedField> derivedFields, Map<String, Object> attributes) {
        for (DerivedField derived : derivedFields) {
            switch (derived.kind()) {
                case DEFAULT -> {
                    if (attributes.get(derived.name()) == null) {
                        attributes.put(derived.name(), derived.defaultValue());
                    }
                }
                case FULL_NAME -> attributes.put(derived.name(), fullName(derived.inputs(), attributes));
                case FULL_ADDRESS -> attributes.put(derived.name(), fullAddress(derived.inputs(), attributes));
            }
        }
    }

    private String fullName(List<String> inputs, Map<String, Object> attributes) {
        String first = text(attributes.get(inputs.get(0)));
        String last = text(attributes.get(inputs.get(inputs.size() - 1)));
        if (first == null || last == null) {
            return null;
        }
        StringBuilder name = new StringBuilder(last).append(", ").append(first);
        if (inputs.size() == 3) {
            String middle = text(attributes.get(inputs.get(1)));
            if (middle != null) {
                name.append(' ').append(middle.charAt(0)).append('.');
            }
        }
        return name.toString();
    }

    private String fullAddress(List<String> inputs, Map<String, Object> attributes) {
        List<String> parts = new ArrayList<>();
        int streetParts = inputs.size() == 5 ? 3 : inputs.size();
        for (int i = 0; i < streetParts; i++) {
            String part = text(attributes.get(inputs.get(i)));
            if (part != null) {
                parts.add(part);
            }
        }
        if (inputs.size() == 5) {
            String stateZip = String.join(" ", inputs.subList(3, 5).stream()
                    .map(attributes::get)
                    .map(DerivedFieldCalculator::text)
                    .filter(Objects::nonNull)
                    .toList());
            if (!stateZip.isEmpty()) {
                parts.add(stateZip);
            }
        }
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
