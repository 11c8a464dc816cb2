package com.eainde.extraction.gap;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Counts of missing fields, overall and per section.
 */
public record GapSummary(
        @JsonProperty("total_missing") int totalMissing,
        @JsonProperty("critical_missing") int criticalMissing,
        @JsonProperty("by_section") Map<String, Integer> bySection) {

    public GapSummary {
        bySection = bySection == null ? Map.of() : Map.copyOf(bySection);
    }
}
