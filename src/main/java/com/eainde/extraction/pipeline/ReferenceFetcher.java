package com.eainde.extraction.pipeline;

import java.util.List;

/**
 * Resolves external references to the text they point at. References that
 * cannot be fetched are skipped, not reported as errors.
 */
@FunctionalInterface
public interface ReferenceFetcher {

    List<String> fetch(List<String> references);

    static ReferenceFetcher none() {
        return references -> List.of();
    }
}
