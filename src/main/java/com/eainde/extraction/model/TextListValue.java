package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * List-of-strings leaf.
 */
public record TextListValue(@JsonValue List<String> values) implements FieldValue {

    public static final TextListValue EMPTY = new TextListValue(List.of());

    public TextListValue {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static TextListValue of(String... values) {
        return new TextListValue(List.of(values));
    }

    /**
     * A list counts as empty when it has no items or only blank items.
     */
    @Override
    public boolean isEmpty() {
        return values.stream().allMatch(v -> v == null || v.isBlank());
    }
}
