package com.eainde.extraction.pipeline;

import java.util.List;

/**
 * Output of a {@link DocumentDecoder}: plain text plus the external
 * references (e.g. annexure links) found in the source.
 */
public record DecodedDocument(String text, List<String> references) {

    public DecodedDocument {
        text = text == null ? "" : text;
        references = references == null ? List.of() : List.copyOf(references);
    }
}
