package com.eainde.extraction.pipeline;

import com.eainde.extraction.model.CandidateRecord;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final envelope: the cleaned record with its processing metadata under a
 * reserved top-level key.
 */
public record ExtractionResult(CandidateRecord record, ProcessingMetadata metadata) {

    public static final String METADATA_KEY = "_metadata";

    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>(record.root().fields());
        json.put(METADATA_KEY, metadata);
        return json;
    }
}
