package com.eainde.extraction.consolidate;

import com.eainde.extraction.model.FieldValue;
import com.eainde.extraction.model.SectionValue;
import com.eainde.extraction.model.TextListValue;
import com.eainde.extraction.model.TextValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Target shape of the tender record.
 *
 * <p>The template is a JSON document whose leaves are {@code ""} (text) or
 * {@code []} (list of text). It doubles as the set of default values and as
 * the schema text shown to the extraction capability.</p>
 */
public final class ExtractionSchema {

    public static final String DEFAULT_LOCATION = "schema/tender-schema.json";

    private final SectionValue template;
    private final String json;

    private ExtractionSchema(SectionValue template, String json) {
        this.template = template;
        this.json = json;
    }

    public static ExtractionSchema load(ObjectMapper objectMapper) {
        return load(objectMapper, DEFAULT_LOCATION);
    }

    public static ExtractionSchema load(ObjectMapper objectMapper, String classpathLocation) {
        try (InputStream in = new ClassPathResource(classpathLocation).getInputStream()) {
            return fromJson(objectMapper, objectMapper.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load extraction schema " + classpathLocation, e);
        }
    }

    public static ExtractionSchema fromJson(ObjectMapper objectMapper, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Schema template must be a JSON object");
        }
        try {
            String pretty = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
            return new ExtractionSchema(shapeOf(root), pretty);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot render extraction schema", e);
        }
    }

    private static SectionValue shapeOf(JsonNode node) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode value = entry.getValue();
            if (value.isObject()) {
                fields.put(entry.getKey(), shapeOf(value));
            } else if (value.isArray()) {
                fields.put(entry.getKey(), TextListValue.EMPTY);
            } else {
                fields.put(entry.getKey(), TextValue.EMPTY);
            }
        }
        return new SectionValue(fields);
    }

    public SectionValue template() {
        return template;
    }

    /** Pretty-printed template for prompts. */
    public String toJson() {
        return json;
    }
}
