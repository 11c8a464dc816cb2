package com.eainde.extraction.model;

import java.util.List;
import java.util.Objects;

/**
 * A decoded source document.
 *
 * @param identifier file name or other caller-supplied id
 * @param text       decoded text
 * @param references external references (e.g. linked annexure URLs) discovered while decoding
 */
public record Document(String identifier, String text, List<String> references) {

    public Document {
        Objects.requireNonNull(identifier, "identifier");
        text = text == null ? "" : text;
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static Document of(String identifier, String text) {
        return new Document(identifier, text, List.of());
    }
}
