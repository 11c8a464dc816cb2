package com.eainde.extraction.classify;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of classifying the combined document text.
 *
 * @param documentType the selected label
 * @param scores       weighted indicator score per candidate label
 */
public record ClassificationScore(DocumentType documentType, Map<DocumentType, Integer> scores) {

    public ClassificationScore {
        scores = scores == null || scores.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(scores));
    }

    public int scoreOf(DocumentType type) {
        return scores.getOrDefault(type, 0);
    }
}
