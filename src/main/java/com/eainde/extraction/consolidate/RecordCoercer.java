package com.eainde.extraction.consolidate;

import com.eainde.extraction.model.CandidateRecord;
import com.eainde.extraction.model.FieldValue;
import com.eainde.extraction.model.SectionValue;
import com.eainde.extraction.model.TextListValue;
import com.eainde.extraction.model.TextValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonicalizes capability output against the schema template.
 *
 * <h3>Coercion rules</h3>
 * <ul>
 *   <li>text expected: array → items joined by {@code "; "}, object → compact JSON,
 *       scalar → its text, null → {@code ""}</li>
 *   <li>list expected: array → each item as text, non-blank scalar → singleton list,
 *       object → singleton list holding its JSON, null/blank → empty list</li>
 *   <li>section expected: object → recurse, anything else → template defaults</li>
 *   <li>keys not present in the template are dropped</li>
 * </ul>
 *
 * <p>Coercion never fails; a value that cannot be rendered becomes {@code ""}.</p>
 */
@Slf4j
public class RecordCoercer {

    private static final String LIST_JOINER = "; ";

    private final ObjectMapper objectMapper;

    public RecordCoercer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Full record: every template field is present, missing ones take the template default.
     */
    public CandidateRecord coerce(JsonNode node, SectionValue template) {
        return new CandidateRecord(coerceSection(node, template, true));
    }

    /**
     * Partial record: only fields present in {@code node} are kept, each in its template shape.
     * Used for targeted refill answers.
     */
    public CandidateRecord coercePartial(JsonNode node, SectionValue template) {
        return new CandidateRecord(coerceSection(node, template, false));
    }

    private SectionValue coerceSection(JsonNode node, SectionValue template, boolean fillDefaults) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        boolean isObject = node != null && node.isObject();

        for (Map.Entry<String, FieldValue> slot : template.fields().entrySet()) {
            String key = slot.getKey();
            FieldValue expected = slot.getValue();
            JsonNode child = isObject ? node.get(key) : null;

            if (child == null || child.isMissingNode()) {
                if (fillDefaults) fields.put(key, expected);
                continue;
            }

            if (expected instanceof SectionValue section) {
                if (child.isObject()) {
                    fields.put(key, coerceSection(child, section, fillDefaults));
                } else if (fillDefaults) {
                    log.debug("Expected section at '{}' but got {}; using defaults", key, child.getNodeType());
                    fields.put(key, section);
                }
            } else if (expected instanceof TextListValue) {
                fields.put(key, toList(child));
            } else {
                fields.put(key, TextValue.of(toText(child)));
            }
        }
        return new SectionValue(fields);
    }

    String toText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return "";
        if (node.isValueNode()) return node.asText();
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            node.forEach(item -> parts.add(toText(item)));
            return String.join(LIST_JOINER, parts);
        }
        return toJson(node);
    }

    TextListValue toList(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return TextListValue.EMPTY;
        if (node.isArray()) {
            List<String> items = new ArrayList<>();
            node.forEach(item -> items.add(toText(item)));
            return new TextListValue(items);
        }
        String single = node.isObject() ? toJson(node) : node.asText();
        return single.isBlank() ? TextListValue.EMPTY : new TextListValue(List.of(single));
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            log.warn("Could not render nested value as text, defaulting to empty: {}", e.getOriginalMessage());
            return "";
        }
    }
}
