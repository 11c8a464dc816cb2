package com.eainde.extraction.gap;

import com.eainde.extraction.capability.ExtractionClient;
import com.eainde.extraction.capability.PromptCatalog;
import com.eainde.extraction.consolidate.ExtractionSchema;
import com.eainde.extraction.consolidate.RecordCoercer;
import com.eainde.extraction.model.CandidateRecord;
import com.eainde.extraction.model.Document;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Second-chance extraction for critical fields the first pass left empty.
 *
 * <p>One capability call per run at most. The answer is coerced to the
 * schema shape and merged with {@link RecordMerger#deepMerge}, so an empty
 * or placeholder answer never erases existing data. A failed call is not
 * absorbed here; it propagates to the orchestrator.</p>
 */
@Slf4j
public class GapRefiller {

    public static final int DEFAULT_DOCUMENT_CHAR_LIMIT = 15_000;

    /** Output allowance reserved on top of the prompt estimate. */
    static final int RESPONSE_TOKEN_ALLOWANCE = 2_000;

    private final ExtractionClient client;
    private final PromptCatalog prompts;
    private final RecordCoercer coercer;
    private final ExtractionSchema schema;
    private final int documentCharLimit;

    public GapRefiller(ExtractionClient client, PromptCatalog prompts, RecordCoercer coercer,
                       ExtractionSchema schema, int documentCharLimit) {
        this.client = client;
        this.prompts = prompts;
        this.coercer = coercer;
        this.schema = schema;
        this.documentCharLimit = documentCharLimit;
    }

    public CandidateRecord refill(CandidateRecord record, List<MissingField> criticalGaps, List<Document> documents) {
        if (criticalGaps.isEmpty()) {
            return record;
        }
        log.info("Attempting to fill {} critical gaps", criticalGaps.size());

        String prompt = prompts.render(PromptCatalog.GAP_REFILL, Map.of(
                "MISSING_FIELDS", missingFieldList(criticalGaps),
                "DOCUMENT_CONTEXT", documentContext(documents)));

        JsonNode answer = client.callForJson(PromptCatalog.GAP_REFILL, prompt, RESPONSE_TOKEN_ALLOWANCE);
        CandidateRecord updates = coercer.coercePartial(answer, schema.template());
        return RecordMerger.deepMerge(record, updates);
    }

    static String missingFieldList(List<MissingField> gaps) {
        return gaps.stream()
                .map(gap -> "- " + gap.path())
                .collect(Collectors.joining("\n"));
    }

    String documentContext(List<Document> documents) {
        return documents.stream()
                .map(doc -> "--- Doc: " + doc.identifier() + " ---\n" + truncate(doc.text()))
                .collect(Collectors.joining("\n"));
    }

    private String truncate(String text) {
        return text.length() <= documentCharLimit ? text : text.substring(0, documentCharLimit);
    }
}
