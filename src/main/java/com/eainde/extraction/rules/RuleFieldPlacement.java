package com.eainde.extraction.rules;

import com.eainde.extraction.model.FieldPath;
import com.eainde.extraction.model.FieldValue;
import com.eainde.extraction.model.SectionValue;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a flat rule field name to its path in the schema template by
 * leaf name. The first leaf with a given name, in template order, wins.
 */
public class RuleFieldPlacement {

    private final Map<String, FieldPath> pathsByLeafName = new HashMap<>();

    public RuleFieldPlacement(SectionValue template) {
        index(template, null);
    }

    public Optional<FieldPath> pathOf(String fieldName) {
        return Optional.ofNullable(pathsByLeafName.get(fieldName));
    }

    private void index(SectionValue section, FieldPath parent) {
        for (Map.Entry<String, FieldValue> entry : section.fields().entrySet()) {
            FieldPath path = parent == null ? FieldPath.of(entry.getKey()) : parent.child(entry.getKey());
            if (entry.getValue() instanceof SectionValue child) {
                index(child, path);
            } else {
                pathsByLeafName.putIfAbsent(entry.getKey(), path);
            }
        }
    }
}
