package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * String leaf.
 */
public record TextValue(@JsonValue String value) implements FieldValue {

    public static final TextValue EMPTY = new TextValue("");

    public TextValue {
        Objects.requireNonNull(value, "value");
    }

    public static TextValue of(String value) {
        return value == null || value.isEmpty() ? EMPTY : new TextValue(value);
    }

    @Override
    public boolean isEmpty() {
        return Placeholders.isGapToken(value);
    }
}
