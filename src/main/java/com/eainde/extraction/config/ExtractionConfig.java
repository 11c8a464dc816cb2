package com.eainde.extraction.config;

import com.eainde.extraction.budget.RateBudgetController;
import com.eainde.extraction.capability.ChatModelExtractionCapability;
import com.eainde.extraction.capability.ExtractionCapability;
import com.eainde.extraction.capability.ExtractionClient;
import com.eainde.extraction.capability.JsonResponseParser;
import com.eainde.extraction.capability.PromptCatalog;
import com.eainde.extraction.capability.RetryPolicy;
import com.eainde.extraction.chunk.ChunkPlanner;
import com.eainde.extraction.classify.DocumentTypeClassifier;
import com.eainde.extraction.concurrent.MdcAwareExecutor;
import com.eainde.extraction.consolidate.Consolidator;
import com.eainde.extraction.consolidate.ExtractionSchema;
import com.eainde.extraction.consolidate.RecordCoercer;
import com.eainde.extraction.fanout.FanOutExtractor;
import com.eainde.extraction.gap.CriticalFieldRegistry;
import com.eainde.extraction.gap.GapAnalyzer;
import com.eainde.extraction.gap.GapRefiller;
import com.eainde.extraction.pipeline.DocumentDecoder;
import com.eainde.extraction.pipeline.ExtractionPipelineOrchestrator;
import com.eainde.extraction.pipeline.ReferenceFetcher;
import com.eainde.extraction.pipeline.TenderExtractionService;
import com.eainde.extraction.rules.RegexRuleFieldExtractor;
import com.eainde.extraction.rules.RuleFieldExtractor;
import com.eainde.extraction.rules.RuleFieldPlacement;
import com.eainde.extraction.validation.CompletenessValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the tender extraction pipeline.
 *
 * <p>Every tunable has a default matching the values the pipeline was
 * calibrated with; {@code application.yml} only needs the capability
 * endpoint and key.</p>
 *
 * <pre>
 * ChatModel → ExtractionCapability ─┐
 * RateBudgetController ─────────────┼─▶ ExtractionClient ─▶ Consolidator / GapRefiller / orchestrator
 * RetryPolicy ──────────────────────┘
 * </pre>
 */
@Slf4j
@Configuration
public class ExtractionConfig {

    // ── Capability ──────────────────────────────────────────────────────

    @Value("${extraction.capability.base-url:https://api.groq.com/openai/v1}")
    private String baseUrl;

    @Value("${extraction.capability.api-key:}")
    private String apiKey;

    @Value("${extraction.capability.model-name:openai/gpt-oss-120b}")
    private String modelName;

    @Value("${extraction.capability.temperature:0.0}")
    private double temperature;

    @Value("${extraction.capability.max-tokens:6000}")
    private int maxTokens;

    @Value("${extraction.capability.timeout-seconds:120}")
    private long timeoutSeconds;

    // ── Rate budget ─────────────────────────────────────────────────────

    @Value("${extraction.rate.requests-per-minute:3000}")
    private int requestsPerMinute;

    @Value("${extraction.rate.tokens-per-minute:1000000}")
    private long tokensPerMinute;

    // ── Retry ───────────────────────────────────────────────────────────

    @Value("${extraction.retry.max-attempts:5}")
    private int maxAttempts;

    @Value("${extraction.retry.base-delay-ms:2000}")
    private long baseDelayMs;

    @Value("${extraction.retry.rate-limit-penalty-ms:5000}")
    private long rateLimitPenaltyMs;

    @Value("${extraction.retry.max-jitter-ms:1000}")
    private long maxJitterMs;

    // ── Strategy & sizing ───────────────────────────────────────────────

    @Value("${extraction.single-pass.token-limit:40000}")
    private int singlePassTokenLimit;

    @Value("${extraction.single-pass.context-budget:15000}")
    private int contextBudget;

    @Value("${extraction.chunking.max-chunk-chars:8000}")
    private int maxChunkChars;

    @Value("${extraction.fan-out.max-concurrency:20}")
    private int maxConcurrency;

    @Value("${extraction.consolidation.max-context-chars:120000}")
    private int maxContextChars;

    @Value("${extraction.refill.document-char-limit:15000}")
    private int refillDocumentCharLimit;

    @Value("${extraction.schema.location:" + ExtractionSchema.DEFAULT_LOCATION + "}")
    private String schemaLocation;

    // =========================================================================
    //  Capability
    // =========================================================================

    /** Skipped when the host context already supplies a {@link ChatModel}. */
    @Bean
    @ConditionalOnMissingBean(ChatModel.class)
    public ChatModel extractionChatModel() {
        if (apiKey.isBlank()) {
            log.warn("extraction.capability.api-key is not set; capability calls will be rejected");
        }
        log.info("Extraction capability: model {} at {}", modelName, baseUrl);
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(0)
                .build();
    }

    @Bean
    public ExtractionCapability extractionCapability(ChatModel extractionChatModel) {
        return new ChatModelExtractionCapability(extractionChatModel);
    }

    @Bean
    public RateBudgetController rateBudgetController() {
        log.info("Rate budget: {} requests/min, {} tokens/min", requestsPerMinute, tokensPerMinute);
        return new RateBudgetController(requestsPerMinute, tokensPerMinute);
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxAttempts,
                Duration.ofMillis(baseDelayMs),
                Duration.ofMillis(rateLimitPenaltyMs),
                Duration.ofMillis(maxJitterMs));
    }

    @Bean
    public ExtractionClient extractionClient(ExtractionCapability capability,
                                             RateBudgetController rateBudgetController,
                                             RetryPolicy retryPolicy,
                                             ObjectMapper objectMapper) {
        return new ExtractionClient(capability, rateBudgetController, retryPolicy,
                new JsonResponseParser(objectMapper));
    }

    @Bean
    public PromptCatalog promptCatalog() {
        return new PromptCatalog();
    }

    // =========================================================================
    //  Schema & pipeline components
    // =========================================================================

    @Bean
    public ExtractionSchema extractionSchema(ObjectMapper objectMapper) {
        return ExtractionSchema.load(objectMapper, schemaLocation);
    }

    @Bean
    public RecordCoercer recordCoercer(ObjectMapper objectMapper) {
        return new RecordCoercer(objectMapper);
    }

    @Bean
    public ChunkPlanner chunkPlanner(ObjectMapper objectMapper) {
        return ChunkPlanner.builder()
                .maxChunkChars(maxChunkChars)
                .objectMapper(objectMapper)
                .build();
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor fanOutExecutor() {
        return new MdcAwareExecutor("fan-out");
    }

    @Bean
    public FanOutExtractor fanOutExtractor(RateBudgetController rateBudgetController, MdcAwareExecutor fanOutExecutor) {
        return new FanOutExtractor(rateBudgetController, fanOutExecutor);
    }

    @Bean
    public RuleFieldExtractor ruleFieldExtractor() {
        return new RegexRuleFieldExtractor();
    }

    @Bean
    public Consolidator consolidator(ExtractionClient extractionClient,
                                     PromptCatalog promptCatalog,
                                     RecordCoercer recordCoercer,
                                     ObjectMapper objectMapper,
                                     ExtractionSchema extractionSchema) {
        return new Consolidator(extractionClient, promptCatalog, recordCoercer, objectMapper,
                new RuleFieldPlacement(extractionSchema.template()), maxContextChars);
    }

    @Bean
    public GapAnalyzer gapAnalyzer() {
        return new GapAnalyzer(CriticalFieldRegistry.defaults());
    }

    @Bean
    public GapRefiller gapRefiller(ExtractionClient extractionClient,
                                   PromptCatalog promptCatalog,
                                   RecordCoercer recordCoercer,
                                   ExtractionSchema extractionSchema) {
        return new GapRefiller(extractionClient, promptCatalog, recordCoercer, extractionSchema,
                refillDocumentCharLimit);
    }

    @Bean
    public ExtractionPipelineOrchestrator extractionPipelineOrchestrator(ExtractionClient extractionClient,
                                                                         PromptCatalog promptCatalog,
                                                                         RecordCoercer recordCoercer,
                                                                         ExtractionSchema extractionSchema,
                                                                         ObjectMapper objectMapper,
                                                                         ChunkPlanner chunkPlanner,
                                                                         FanOutExtractor fanOutExtractor,
                                                                         RuleFieldExtractor ruleFieldExtractor,
                                                                         Consolidator consolidator,
                                                                         GapAnalyzer gapAnalyzer,
                                                                         GapRefiller gapRefiller) {
        return ExtractionPipelineOrchestrator.builder()
                .classifier(new DocumentTypeClassifier())
                .ruleExtractor(ruleFieldExtractor)
                .chunkPlanner(chunkPlanner)
                .fanOut(fanOutExtractor)
                .consolidator(consolidator)
                .gapAnalyzer(gapAnalyzer)
                .gapRefiller(gapRefiller)
                .validator(new CompletenessValidator())
                .client(extractionClient)
                .prompts(promptCatalog)
                .coercer(recordCoercer)
                .schema(extractionSchema)
                .objectMapper(objectMapper)
                .singlePassTokenLimit(singlePassTokenLimit)
                .contextBudget(contextBudget)
                .maxConcurrency(maxConcurrency)
                .build();
    }

    // =========================================================================
    //  Entry point
    // =========================================================================

    @Bean
    public TenderExtractionService tenderExtractionService(ExtractionPipelineOrchestrator orchestrator) {
        return new TenderExtractionService(DocumentDecoder.utf8Text(), ReferenceFetcher.none(), orchestrator);
    }
}
