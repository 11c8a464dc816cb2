package com.eainde.extraction.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExtractionStrategy {

    /** Condensed context, one extraction call. */
    SINGLE_PASS,

    /** Chunk, fan out, consolidate, one structuring call. */
    HIERARCHICAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
