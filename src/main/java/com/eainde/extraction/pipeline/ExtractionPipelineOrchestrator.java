package com.eainde.extraction.pipeline;

import com.eainde.extraction.capability.ExtractionClient;
import com.eainde.extraction.capability.PromptCatalog;
import com.eainde.extraction.chunk.Chunk;
import com.eainde.extraction.chunk.ChunkPlanner;
import com.eainde.extraction.chunk.SectionExtractor;
import com.eainde.extraction.chunk.TokenEstimator;
import com.eainde.extraction.classify.ClassificationScore;
import com.eainde.extraction.classify.DocumentType;
import com.eainde.extraction.classify.DocumentTypeClassifier;
import com.eainde.extraction.consolidate.Consolidator;
import com.eainde.extraction.consolidate.ExtractionSchema;
import com.eainde.extraction.consolidate.RecordCoercer;
import com.eainde.extraction.exception.MalformedExtractionException;
import com.eainde.extraction.fanout.FanOutExtractor;
import com.eainde.extraction.gap.GapAnalyzer;
import com.eainde.extraction.gap.GapRefiller;
import com.eainde.extraction.gap.GapSummary;
import com.eainde.extraction.model.CandidateRecord;
import com.eainde.extraction.model.Document;
import com.eainde.extraction.model.FieldValue;
import com.eainde.extraction.rules.RuleExtraction;
import com.eainde.extraction.rules.RuleFieldExtractor;
import com.eainde.extraction.validation.CompletenessValidator;
import com.eainde.extraction.validation.ValidationReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Top-level orchestrator for one tender extraction run.
 *
 * <h3>Routing:</h3>
 * <ul>
 *   <li><b>At or under the single-pass ceiling</b> → condensed context, one call</li>
 *   <li><b>Over the ceiling</b> → chunk, fan out, consolidate, one structuring call</li>
 * </ul>
 *
 * <h3>Stages:</h3>
 * <pre>
 * CLASSIFY     combined text → document type
 * PRE_EXTRACT  rule extractor → flat field map
 * SINGLE_PASS  condensed context → per-type prompt → record
 *   or
 * HIERARCHICAL filter lines → split → MAP (fan-out) → merge → REDUCE (final structure)
 * GAP_FILL     rule fields → gap scan → one refill call if critical gaps remain
 * FINALIZE     validate → strip placeholders → envelope with _metadata
 * </pre>
 *
 * <p>Chunk failures are absorbed by the fan-out. Failures of the single-pass,
 * structuring or refill calls propagate to the caller.</p>
 */
@Slf4j
public class ExtractionPipelineOrchestrator {

    static final String MDC_RUN_ID = "runId";
    static final String MDC_STAGE = "stage";

    public static final int DEFAULT_SINGLE_PASS_TOKEN_LIMIT = 40_000;
    public static final int DEFAULT_CONTEXT_BUDGET = 15_000;

    static final String SINGLE_PASS_CALL = "single_pass";
    static final int SINGLE_PASS_RESPONSE_TOKENS = 2_000;

    private final DocumentTypeClassifier classifier;
    private final RuleFieldExtractor ruleExtractor;
    private final ChunkPlanner chunkPlanner;
    private final FanOutExtractor fanOut;
    private final Consolidator consolidator;
    private final GapAnalyzer gapAnalyzer;
    private final GapRefiller gapRefiller;
    private final CompletenessValidator validator;
    private final RecordFinalizer finalizer;
    private final ExtractionClient client;
    private final PromptCatalog prompts;
    private final RecordCoercer coercer;
    private final ExtractionSchema schema;
    private final ObjectMapper objectMapper;
    private final int singlePassTokenLimit;
    private final int contextBudget;
    private final int maxConcurrency;

    private ExtractionPipelineOrchestrator(Builder builder) {
        this.classifier = Objects.requireNonNull(builder.classifier, "classifier");
        this.ruleExtractor = Objects.requireNonNull(builder.ruleExtractor, "ruleExtractor");
        this.chunkPlanner = Objects.requireNonNull(builder.chunkPlanner, "chunkPlanner");
        this.fanOut = Objects.requireNonNull(builder.fanOut, "fanOut");
        this.consolidator = Objects.requireNonNull(builder.consolidator, "consolidator");
        this.gapAnalyzer = Objects.requireNonNull(builder.gapAnalyzer, "gapAnalyzer");
        this.gapRefiller = Objects.requireNonNull(builder.gapRefiller, "gapRefiller");
        this.validator = Objects.requireNonNull(builder.validator, "validator");
        this.finalizer = Objects.requireNonNull(builder.finalizer, "finalizer");
        this.client = Objects.requireNonNull(builder.client, "client");
        this.prompts = Objects.requireNonNull(builder.prompts, "prompts");
        this.coercer = Objects.requireNonNull(builder.coercer, "coercer");
        this.schema = Objects.requireNonNull(builder.schema, "schema");
        this.objectMapper = Objects.requireNonNull(builder.objectMapper, "objectMapper");
        this.singlePassTokenLimit = builder.singlePassTokenLimit;
        this.contextBudget = builder.contextBudget;
        this.maxConcurrency = builder.maxConcurrency;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Runs the full pipeline over {@code documents}, treated as one tender.
     *
     * @throws com.eainde.extraction.exception.CapabilityUnavailableException when a required call exhausts its retries
     * @throws MalformedExtractionException when a required call answers with unrecoverable JSON
     */
    public ExtractionResult run(List<Document> documents) {
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("At least one document is required");
        }
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_RUN_ID, runId);
        try {
            return execute(documents);
        } catch (RuntimeException e) {
            log.error("Extraction run {} failed", runId, e);
            throw e;
        } finally {
            MDC.remove(MDC_STAGE);
            MDC.remove(MDC_RUN_ID);
        }
    }

    private ExtractionResult execute(List<Document> documents) {
        String combinedText = combine(documents);
        List<String> fileNames = documents.stream().map(Document::identifier).toList();
        log.info("Starting extraction for {} documents ({} chars)", documents.size(), combinedText.length());

        // ── CLASSIFY ────────────────────────────────────────────────────
        stage(PipelineStage.CLASSIFY);
        ClassificationScore classification = classifier.classify(combinedText);
        DocumentType documentType = classification.documentType();
        log.info("Document type {} (scores {})", documentType.label(), classification.scores());

        // ── PRE_EXTRACT ─────────────────────────────────────────────────
        stage(PipelineStage.PRE_EXTRACT);
        RuleExtraction rules = ruleExtractor.extract(combinedText);
        Map<String, FieldValue> preExtracted = rules.fields();
        log.info("Rule extraction found {} fields", preExtracted.size());

        // ── SINGLE_PASS | HIERARCHICAL ──────────────────────────────────
        int estimatedTokens = TokenEstimator.estimate(combinedText);
        ExtractionStrategy strategy = chunkPlanner.needsChunking(combinedText, singlePassTokenLimit)
                ? ExtractionStrategy.HIERARCHICAL
                : ExtractionStrategy.SINGLE_PASS;

        CandidateRecord record;
        if (strategy == ExtractionStrategy.SINGLE_PASS) {
            stage(PipelineStage.SINGLE_PASS);
            log.info("SINGLE_PASS path — ~{} estimated tokens within {} limit", estimatedTokens, singlePassTokenLimit);
            record = executeSinglePass(combinedText, preExtracted, documentType);
        } else {
            stage(PipelineStage.HIERARCHICAL);
            log.info("HIERARCHICAL path — ~{} estimated tokens exceeds {} limit", estimatedTokens, singlePassTokenLimit);
            record = executeHierarchical(combinedText, preExtracted);
        }

        // ── GAP_FILL ────────────────────────────────────────────────────
        stage(PipelineStage.GAP_FILL);
        record = consolidator.applyRuleFields(record, preExtracted);
        GapSummary gaps = gapAnalyzer.summarize(record);
        int fieldsFilled = 0;
        if (gaps.criticalMissing() > 0) {
            log.info("Filling {} critical gaps for {} (missing by section {})",
                    gaps.criticalMissing(), documentType.label(), gaps.bySection());
            record = gapRefiller.refill(record, gapAnalyzer.criticalGaps(record), documents);
            GapSummary remaining = gapAnalyzer.summarize(record);
            fieldsFilled = Math.max(0, gaps.criticalMissing() - remaining.criticalMissing());
            log.info("Refill recovered {} of {} critical fields", fieldsFilled, gaps.criticalMissing());
            gaps = remaining;
        }

        // ── FINALIZE ────────────────────────────────────────────────────
        stage(PipelineStage.FINALIZE);
        ValidationReport validation = validator.validate(record, documentType);
        if (!validation.valid()) {
            log.warn("Validation reported {} missing fields and {} warnings",
                    validation.missingFields().size(), validation.warnings().size());
        }
        ProcessingMetadata metadata = new ProcessingMetadata(
                documentType, fileNames, estimatedTokens, fieldsFilled, gaps, strategy, validation);

        log.info("Extraction complete — strategy {}, {} fields filled by refill", strategy.label(), fieldsFilled);
        return new ExtractionResult(finalizer.finalizeRecord(record), metadata);
    }

    // =========================================================================
    //  Single pass
    // =========================================================================

    private CandidateRecord executeSinglePass(String text, Map<String, FieldValue> preExtracted, DocumentType type) {
        Map<String, String> sections = SectionExtractor.extract(text);
        String context = chunkPlanner.buildCondensedContext(text, preExtracted, sections, contextBudget);

        String prompt = prompts.render(prompts.singlePassTemplateName(type), Map.of(
                "SCHEMA_JSON", schema.toJson(),
                "RULE_EXTRACTED_DATA", toPrettyJson(preExtracted),
                "TENDER_TEXT", context));

        JsonNode answer = client.callForJson(SINGLE_PASS_CALL, prompt, SINGLE_PASS_RESPONSE_TOKENS);
        return coercer.coerce(answer, schema.template());
    }

    // =========================================================================
    //  Hierarchical: MAP → merge → REDUCE
    // =========================================================================

    private CandidateRecord executeHierarchical(String text, Map<String, FieldValue> preExtracted) {
        List<Chunk> chunks = chunkPlanner.splitToChunks(ChunkPlanner.filterRelevantLines(text));
        log.info("Document split into {} chunks", chunks.size());

        List<String> partials = fanOut.extractAll(chunks, this::summarizeChunk, maxConcurrency);
        String context = consolidator.mergeMicroResults(partials, preExtracted);
        return consolidator.finalStructure(context, schema);
    }

    /**
     * One micro-summary. Budget is already reserved by the fan-out. A JSON
     * answer is re-serialized compactly; anything else is kept verbatim.
     */
    private String summarizeChunk(Chunk chunk) {
        String prompt = prompts.render(PromptCatalog.MICRO_SUMMARY, Map.of("CHUNK_TEXT", chunk.text()));
        String response = client.callPreReserved(PromptCatalog.MICRO_SUMMARY, prompt)
                .orElseThrow(PromptCatalog.MICRO_SUMMARY + " " + chunk.label());
        try {
            return objectMapper.writeValueAsString(client.parser().parse(response));
        } catch (MalformedExtractionException | JsonProcessingException e) {
            log.debug("{} summary is not JSON, keeping raw text", chunk);
            return response;
        }
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    static String combine(List<Document> documents) {
        StringBuilder combined = new StringBuilder();
        for (Document document : documents) {
            combined.append("\n\n=== ").append(document.identifier()).append(" ===\n").append(document.text());
        }
        return combined.toString();
    }

    private String toPrettyJson(Map<String, FieldValue> fields) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pre-extracted fields", e);
        }
    }

    private static void stage(PipelineStage stage) {
        MDC.put(MDC_STAGE, stage.name());
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DocumentTypeClassifier classifier = new DocumentTypeClassifier();
        private RuleFieldExtractor ruleExtractor;
        private ChunkPlanner chunkPlanner = ChunkPlanner.withDefaults();
        private FanOutExtractor fanOut;
        private Consolidator consolidator;
        private GapAnalyzer gapAnalyzer;
        private GapRefiller gapRefiller;
        private CompletenessValidator validator = new CompletenessValidator();
        private RecordFinalizer finalizer = new RecordFinalizer();
        private ExtractionClient client;
        private PromptCatalog prompts;
        private RecordCoercer coercer;
        private ExtractionSchema schema;
        private ObjectMapper objectMapper;
        private int singlePassTokenLimit = DEFAULT_SINGLE_PASS_TOKEN_LIMIT;
        private int contextBudget = DEFAULT_CONTEXT_BUDGET;
        private int maxConcurrency = FanOutExtractor.DEFAULT_MAX_CONCURRENCY;

        public Builder classifier(DocumentTypeClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder ruleExtractor(RuleFieldExtractor ruleExtractor) {
            this.ruleExtractor = ruleExtractor;
            return this;
        }

        public Builder chunkPlanner(ChunkPlanner chunkPlanner) {
            this.chunkPlanner = chunkPlanner;
            return this;
        }

        public Builder fanOut(FanOutExtractor fanOut) {
            this.fanOut = fanOut;
            return this;
        }

        public Builder consolidator(Consolidator consolidator) {
            this.consolidator = consolidator;
            return this;
        }

        public Builder gapAnalyzer(GapAnalyzer gapAnalyzer) {
            this.gapAnalyzer = gapAnalyzer;
            return this;
        }

        public Builder gapRefiller(GapRefiller gapRefiller) {
            this.gapRefiller = gapRefiller;
            return this;
        }

        public Builder validator(CompletenessValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder finalizer(RecordFinalizer finalizer) {
            this.finalizer = finalizer;
            return this;
        }

        public Builder client(ExtractionClient client) {
            this.client = client;
            return this;
        }

        public Builder prompts(PromptCatalog prompts) {
            this.prompts = prompts;
            return this;
        }

        public Builder coercer(RecordCoercer coercer) {
            this.coercer = coercer;
            return this;
        }

        public Builder schema(ExtractionSchema schema) {
            this.schema = schema;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Highest estimated token count still handled in a single pass (inclusive). Default: 40000.
         */
        public Builder singlePassTokenLimit(int singlePassTokenLimit) {
            if (singlePassTokenLimit < 1) throw new IllegalArgumentException("singlePassTokenLimit must be >= 1");
            this.singlePassTokenLimit = singlePassTokenLimit;
            return this;
        }

        /**
         * Token budget of the condensed single-pass context. Default: 15000.
         */
        public Builder contextBudget(int contextBudget) {
            if (contextBudget < 1) throw new IllegalArgumentException("contextBudget must be >= 1");
            this.contextBudget = contextBudget;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency < 1) throw new IllegalArgumentException("maxConcurrency must be >= 1");
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public ExtractionPipelineOrchestrator build() {
            return new ExtractionPipelineOrchestrator(this);
        }
    }
}
