package com.eainde.extraction.pipeline;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Turns raw file content into text. Binary formats (PDF, DOCX) are decoded
 * by implementations supplied by the host application.
 */
@FunctionalInterface
public interface DocumentDecoder {

    DecodedDocument decode(byte[] content);

    /** Reads the content as UTF-8 text with no references. */
    static DocumentDecoder utf8Text() {
        return content -> new DecodedDocument(
                content == null ? "" : new String(content, StandardCharsets.UTF_8), List.of());
    }
}
