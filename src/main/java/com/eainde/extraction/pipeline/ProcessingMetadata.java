package com.eainde.extraction.pipeline;

import com.eainde.extraction.classify.DocumentType;
import com.eainde.extraction.gap.GapSummary;
import com.eainde.extraction.validation.ValidationReport;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * How a record was produced. {@code remainingGaps} counts the fields still
 * missing after the refill, before placeholder cleanup. Rendered under
 * {@link ExtractionResult#METADATA_KEY}.
 */
public record ProcessingMetadata(
        @JsonProperty("document_type") DocumentType documentType,
        @JsonProperty("files_processed") List<String> filesProcessed,
        @JsonProperty("estimated_tokens") int estimatedTokens,
        @JsonProperty("fields_filled_by_refill") int fieldsFilledByRefill,
        @JsonProperty("remaining_gaps") GapSummary remainingGaps,
        @JsonProperty("strategy") ExtractionStrategy strategy,
        @JsonProperty("validation") ValidationReport validation) {

    public ProcessingMetadata {
        filesProcessed = List.copyOf(filesProcessed);
    }
}
