package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named group of child nodes. Insertion order is preserved so that rendered
 * records follow the schema's field order.
 */
public record SectionValue(@JsonValue Map<String, FieldValue> fields) implements FieldValue {

    public static final SectionValue EMPTY = new SectionValue(Map.of());

    public SectionValue {
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Optional<FieldValue> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    /**
     * @return a copy of this section with {@code key} set to {@code value}
     */
    public SectionValue with(String key, FieldValue value) {
        Map<String, FieldValue> copy = new LinkedHashMap<>(fields);
        copy.put(key, value);
        return new SectionValue(copy);
    }

    @Override
    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
