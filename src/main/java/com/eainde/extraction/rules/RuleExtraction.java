package com.eainde.extraction.rules;

import com.eainde.extraction.model.FieldValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields found by a {@link RuleFieldExtractor}, keyed by their flat schema
 * field name (e.g. {@code emd}, {@code bid_end}).
 *
 * @param fields      extracted fields in discovery order
 * @param portalLabel portal the text names, or {@code null} when none matched
 */
public record RuleExtraction(Map<String, FieldValue> fields, String portalLabel) {

    public static final RuleExtraction EMPTY = new RuleExtraction(Map.of(), null);

    public RuleExtraction {
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
