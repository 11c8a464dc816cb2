package com.eainde.extraction.consolidate;

import com.eainde.extraction.capability.ExtractionClient;
import com.eainde.extraction.capability.PromptCatalog;
import com.eainde.extraction.model.CandidateRecord;
import com.eainde.extraction.model.FieldPath;
import com.eainde.extraction.model.FieldValue;
import com.eainde.extraction.rules.RuleFieldPlacement;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REDUCE phase: folds per-chunk partial results into one context and turns it
 * into a schema-shaped record with a single structuring call.
 *
 * <pre>
 * partials ──mergeMicroResults──▶ context ──finalStructure──▶ CandidateRecord
 *                                                    │
 *                          applyRuleFields(record, preExtracted)
 * </pre>
 */
public class Consolidator {

    private static final Logger log = LoggerFactory.getLogger(Consolidator.class);

    public static final int DEFAULT_MAX_CONTEXT_CHARS = 120_000;

    /** Output allowance reserved on top of the prompt estimate for the structuring call. */
    static final int RESPONSE_TOKEN_ALLOWANCE = 2_000;

    static final String PRE_EXTRACTED_LABEL = "PRE-EXTRACTED DATA:\n";
    static final String SUMMARIES_LABEL = "MICRO-SUMMARIES:\n";
    static final String SECTION_SEPARATOR = "\n\n";

    private final ExtractionClient client;
    private final PromptCatalog prompts;
    private final RecordCoercer coercer;
    private final ObjectMapper objectMapper;
    private final RuleFieldPlacement placement;
    private final int maxContextChars;

    public Consolidator(ExtractionClient client,
                        PromptCatalog prompts,
                        RecordCoercer coercer,
                        ObjectMapper objectMapper,
                        RuleFieldPlacement placement,
                        int maxContextChars) {
        if (maxContextChars < 1) throw new IllegalArgumentException("maxContextChars must be >= 1");
        this.client = client;
        this.prompts = prompts;
        this.coercer = coercer;
        this.objectMapper = objectMapper;
        this.placement = placement;
        this.maxContextChars = maxContextChars;
    }

    /**
     * Concatenates the pre-extracted header and numbered chunk sections.
     * Sections are added whole, in order, until the next one would push the
     * context past the character budget; it and every later one are dropped.
     */
    public String mergeMicroResults(List<String> partials, Map<String, FieldValue> preExtracted) {
        StringBuilder context = new StringBuilder()
                .append(PRE_EXTRACTED_LABEL)
                .append(toJson(preExtracted))
                .append(SECTION_SEPARATOR)
                .append(SUMMARIES_LABEL);

        int included = 0;
        for (int i = 0; i < partials.size(); i++) {
            String section = (included == 0 ? "" : SECTION_SEPARATOR)
                    + "--- CHUNK " + (i + 1) + " ---\n" + partials.get(i);
            if (context.length() + section.length() > maxContextChars) {
                log.warn("Consolidated context reached {} chars, dropping {} of {} chunk results",
                        maxContextChars, partials.size() - i, partials.size());
                break;
            }
            context.append(section);
            included++;
        }
        log.debug("Merged {} chunk results into {} chars", included, context.length());
        return context.toString();
    }

    /**
     * One structuring call over {@code context}, canonicalized to the schema.
     * Conflicting values are resolved by the capability as the prompt directs.
     *
     * @throws com.eainde.extraction.exception.CapabilityUnavailableException when retries are exhausted
     * @throws com.eainde.extraction.exception.MalformedExtractionException   when the answer is not JSON
     */
    public CandidateRecord finalStructure(String context, ExtractionSchema schema) {
        String prompt = prompts.render(PromptCatalog.FINAL_MERGE, Map.of(
                "CONTEXT", context,
                "SCHEMA_JSON", schema.toJson()));
        log.info("REDUCE phase: structuring {} chars of consolidated context", context.length());

        JsonNode answer = client.callForJson(PromptCatalog.FINAL_MERGE, prompt, RESPONSE_TOKEN_ALLOWANCE);
        return coercer.coerce(answer, schema.template());
    }

    /**
     * Places each rule field at its schema path where the record is still
     * empty. Extracted values are never replaced; names with no schema slot
     * are skipped.
     */
    public CandidateRecord applyRuleFields(CandidateRecord record, Map<String, FieldValue> preExtracted) {
        CandidateRecord result = record;
        for (Map.Entry<String, FieldValue> entry : preExtracted.entrySet()) {
            Optional<FieldPath> path = placement.pathOf(entry.getKey());
            if (path.isEmpty()) {
                log.debug("Rule field '{}' has no schema slot, skipping", entry.getKey());
                continue;
            }
            boolean empty = result.get(path.get()).map(FieldValue::isEmpty).orElse(true);
            if (empty && !entry.getValue().isEmpty()) {
                result = result.with(path.get(), entry.getValue());
            }
        }
        return result;
    }

    private String toJson(Map<String, FieldValue> fields) {
        try {
            return objectMapper.writeValueAsString(fields == null ? Map.of() : fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pre-extracted fields", e);
        }
    }
}
