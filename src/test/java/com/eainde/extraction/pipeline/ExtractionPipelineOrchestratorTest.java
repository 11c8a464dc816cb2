package com.eainde.extraction.pipeline;

import com.eainde.extraction.capability.ExtractionClient;
import com.eainde.extraction.capability.PromptCatalog;
import com.eainde.extraction.chunk.ChunkPlanner;
import com.eainde.extraction.chunk.TokenEstimator;
import com.eainde.extraction.classify.DocumentType;
import com.eainde.extraction.concurrent.MdcAwareExecutor;
import com.eainde.extraction.consolidate.Consolidator;
import com.eainde.extraction.consolidate.ExtractionSchema;
import com.eainde.extraction.consolidate.RecordCoercer;
import com.eainde.extraction.exception.CapabilityUnavailableException;
import com.eainde.extraction.fanout.FanOutExtractor;
import com.eainde.extraction.gap.CriticalFieldRegistry;
import com.eainde.extraction.gap.GapAnalyzer;
import com.eainde.extraction.gap.GapRefiller;
import com.eainde.extraction.model.Document;
import com.eainde.extraction.model.TextValue;
import com.eainde.extraction.rules.RegexRuleFieldExtractor;
import com.eainde.extraction.rules.RuleExtraction;
import com.eainde.extraction.rules.RuleFieldExtractor;
import com.eainde.extraction.rules.RuleFieldPlacement;
import com.eainde.extraction.support.ScriptedCapability;
import com.eainde.extraction.support.TestClients;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionPipelineOrchestratorTest {

    private static final int CHUNK_CHARS = 1_000;
    private static final int LINE_CHARS = 99;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExtractionSchema schema = ExtractionSchema.load(objectMapper);
    private final MdcAwareExecutor executor = new MdcAwareExecutor("pipeline-test");
    private final RuleFieldExtractor fixedRules =
            text -> new RuleExtraction(Map.of("emd", TextValue.of("₹50000")), null);
    private final GapAnalyzer noCriticalFields = new GapAnalyzer(new CriticalFieldRegistry(Map.of()));

    private ScriptedCapability capability;

    @BeforeEach
    void setUp() {
        capability = new ScriptedCapability();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.close();
    }

    private ExtractionPipelineOrchestrator.Builder orchestrator(RuleFieldExtractor rules, GapAnalyzer analyzer) {
        ExtractionClient client = TestClients.client(capability);
        PromptCatalog prompts = new PromptCatalog();
        RecordCoercer coercer = new RecordCoercer(objectMapper);
        return ExtractionPipelineOrchestrator.builder()
                .ruleExtractor(rules)
                .chunkPlanner(ChunkPlanner.builder().maxChunkChars(CHUNK_CHARS).build())
                .fanOut(new FanOutExtractor(TestClients.unlimitedBudget(), executor))
                .consolidator(new Consolidator(client, prompts, coercer, objectMapper,
                        new RuleFieldPlacement(schema.template()), Consolidator.DEFAULT_MAX_CONTEXT_CHARS))
                .gapAnalyzer(analyzer)
                .gapRefiller(new GapRefiller(client, prompts, coercer, schema, GapRefiller.DEFAULT_DOCUMENT_CHAR_LIMIT))
                .client(client)
                .prompts(prompts)
                .coercer(coercer)
                .schema(schema)
                .objectMapper(objectMapper);
    }

    /** Lines of exactly {@value #LINE_CHARS} characters, ten per chunk. */
    private static String clauses(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> {
                    String prefix = String.format("Clause %03d ", i);
                    return prefix + "x".repeat(LINE_CHARS - prefix.length());
                })
                .collect(Collectors.joining("\n"));
    }

    @Nested
    @DisplayName("Single pass")
    class SinglePass {

        @Test
        @DisplayName("a 500-line document makes exactly one call with header plus full text")
        void run_shouldMakeOneCall_whenUnderCeiling() {
            // Arrange
            String text = clauses(500);
            List<Document> documents = List.of(Document.of("tender.txt", text));
            capability.when(TestClients.SINGLE_PASS_PROMPT,
                    "{\"tender_meta\": {\"tender_id\": \"NIT-7\", \"tender_title\": \"Road works\"}}");
            ExtractionPipelineOrchestrator pipeline = orchestrator(fixedRules, noCriticalFields).build();

            // Act
            ExtractionResult result = pipeline.run(documents);

            // Assert
            assertThat(capability.callCount()).isEqualTo(1);
            String expectedContext = ChunkPlanner.withDefaults()
                    .buildCondensedContext(ExtractionPipelineOrchestrator.combine(documents),
                            Map.of("emd", TextValue.of("₹50000")), Map.of(),
                            ExtractionPipelineOrchestrator.DEFAULT_CONTEXT_BUDGET);
            assertThat(expectedContext).contains("=== COMPLETE TENDER DOCUMENT ===\n").contains(text);
            assertThat(capability.prompts().get(0)).contains(expectedContext);

            assertThat(result.metadata().strategy()).isEqualTo(ExtractionStrategy.SINGLE_PASS);
            assertThat(result.metadata().filesProcessed()).containsExactly("tender.txt");
            assertThat(result.metadata().fieldsFilledByRefill()).isZero();
            assertThat(result.record().text("tender_meta.tender_id")).isEqualTo("NIT-7");
            assertThat(result.record().text("financial_requirements.emd")).isEqualTo("₹50000");
        }

        @Test
        void run_shouldUsePortalPromptAndValidation_whenClassifiedAsGem() {
            String text = "Government e-Marketplace bid on gem.gov.in\nBid Number: GEM/2024/B/4567890\n";
            capability.when("Government e-Marketplace (GeM) bids", "{\"tender_meta\": {\"tender_title\": \"Desktops\"}}");
            ExtractionPipelineOrchestrator pipeline =
                    orchestrator(new RegexRuleFieldExtractor(), noCriticalFields).build();

            ExtractionResult result = pipeline.run(List.of(Document.of("bid.pdf", text)));

            assertThat(capability.callsContaining("Government e-Marketplace (GeM) bids")).isEqualTo(1);
            assertThat(result.metadata().documentType()).isEqualTo(DocumentType.GEM);
            assertThat(result.metadata().validation().documentType()).isEqualTo(DocumentType.GEM);
            assertThat(result.record().text("tender_meta.tender_id")).isEqualTo("GEM/2024/B/4567890");
            assertThat(result.record().text("tender_meta.portal")).isEqualTo("GeM");
        }

        @Test
        void run_shouldRefillCriticalGaps_andCountRecoveredFields() {
            capability.when(TestClients.REFILL_PROMPT, "{\"key_dates\": {\"bid_end\": \"2024-02-01\"}}")
                    .when(TestClients.SINGLE_PASS_PROMPT, "{\"key_dates\": {\"bid_start\": \"2024-01-01\"}}");
            ExtractionPipelineOrchestrator pipeline = orchestrator(text -> RuleExtraction.EMPTY,
                    new GapAnalyzer(CriticalFieldRegistry.defaults())).build();

            ExtractionResult result = pipeline.run(List.of(Document.of("nit.txt", "Bids close on 2024-02-01.")));

            assertThat(capability.callCount()).isEqualTo(2);
            assertThat(capability.callsContaining(TestClients.REFILL_PROMPT)).isEqualTo(1);
            assertThat(result.record().text("key_dates.bid_end")).isEqualTo("2024-02-01");
            assertThat(result.record().text("key_dates.bid_start")).isEqualTo("2024-01-01");
            assertThat(result.metadata().fieldsFilledByRefill()).isEqualTo(1);
        }

        @Test
        @DisplayName("reports the gap summary after refill in the metadata")
        void run_shouldReportRemainingGaps_whenRefillClosesCriticalFields() {
            // Arrange: only the two key dates are critical; refill supplies the missing one
            capability.when(TestClients.REFILL_PROMPT, "{\"key_dates\": {\"bid_end\": \"2024-02-01\"}}")
                    .when(TestClients.SINGLE_PASS_PROMPT, "{\"key_dates\": {\"bid_start\": \"2024-01-01\"}}");
            GapAnalyzer keyDatesOnly = new GapAnalyzer(new CriticalFieldRegistry(
                    Map.of("key_dates", Set.of("bid_start", "bid_end"))));
            ExtractionPipelineOrchestrator pipeline = orchestrator(text -> RuleExtraction.EMPTY, keyDatesOnly).build();

            // Act
            ExtractionResult result = pipeline.run(List.of(Document.of("nit.txt", "Bids close on 2024-02-01.")));

            // Assert
            assertThat(result.metadata().fieldsFilledByRefill()).isEqualTo(1);
            assertThat(result.metadata().remainingGaps().criticalMissing()).isZero();
            assertThat(result.metadata().remainingGaps().totalMissing()).isPositive();
            assertThat(result.metadata().remainingGaps().bySection()).containsKey("tender_meta");
        }

        @Test
        @DisplayName("a document estimated exactly at the ceiling still goes single pass")
        void run_shouldStaySinglePass_whenEstimateEqualsCeiling() {
            // Arrange
            List<Document> documents = List.of(Document.of("tender.txt", clauses(20)));
            int estimate = TokenEstimator.estimate(ExtractionPipelineOrchestrator.combine(documents));
            capability.when(TestClients.SINGLE_PASS_PROMPT, "{\"tender_meta\": {\"tender_id\": \"NIT-1\"}}")
                    .when(TestClients.MICRO_PROMPT, "summary")
                    .when(TestClients.FINAL_PROMPT, "{\"tender_meta\": {\"tender_id\": \"NIT-2\"}}");

            // Act
            ExtractionResult atCeiling = orchestrator(fixedRules, noCriticalFields)
                    .singlePassTokenLimit(estimate).build().run(documents);
            ExtractionResult overCeiling = orchestrator(fixedRules, noCriticalFields)
                    .singlePassTokenLimit(estimate - 1).build().run(documents);

            // Assert
            assertThat(atCeiling.metadata().strategy()).isEqualTo(ExtractionStrategy.SINGLE_PASS);
            assertThat(atCeiling.record().text("tender_meta.tender_id")).isEqualTo("NIT-1");
            assertThat(overCeiling.metadata().strategy()).isEqualTo(ExtractionStrategy.HIERARCHICAL);
            assertThat(overCeiling.record().text("tender_meta.tender_id")).isEqualTo("NIT-2");
        }
    }

    @Nested
    @DisplayName("Hierarchical")
    class Hierarchical {

        @Test
        @DisplayName("five chunks fan out to five calls plus one structuring call")
        void run_shouldMakeSixCalls_whenSplitIntoFiveChunks() {
            // Arrange: 49 lines plus the file banner make five chunks of at most ten lines
            String text = clauses(49);
            capability.callDelay(20)
                    .when(TestClients.MICRO_PROMPT, "```json\n{\"clauses\": \"summarised\"}\n```")
                    .when(TestClients.FINAL_PROMPT, "{\"tender_meta\": {\"tender_id\": \"NIT-9\"}}");
            int ceiling = (text.length() / 4) / 3;
            ExtractionPipelineOrchestrator pipeline = orchestrator(fixedRules, noCriticalFields)
                    .singlePassTokenLimit(ceiling)
                    .maxConcurrency(2)
                    .build();

            // Act
            ExtractionResult result = pipeline.run(List.of(Document.of("tender.txt", text)));

            // Assert
            assertThat(capability.callsContaining(TestClients.MICRO_PROMPT)).isEqualTo(5);
            assertThat(capability.callsContaining(TestClients.FINAL_PROMPT)).isEqualTo(1);
            assertThat(capability.callCount()).isEqualTo(6);
            assertThat(capability.maxInFlight()).isLessThanOrEqualTo(2);

            String finalPrompt = capability.prompts().stream()
                    .filter(p -> p.contains(TestClients.FINAL_PROMPT)).findFirst().orElseThrow();
            assertThat(finalPrompt).contains("--- CHUNK 5 ---\n{\"clauses\":\"summarised\"}")
                    .doesNotContain("--- CHUNK 6 ---")
                    .contains("PRE-EXTRACTED DATA:\n{\"emd\":\"₹50000\"}");

            assertThat(result.metadata().strategy()).isEqualTo(ExtractionStrategy.HIERARCHICAL);
            assertThat(result.metadata().estimatedTokens()).isGreaterThan(ceiling);
            assertThat(result.record().text("tender_meta.tender_id")).isEqualTo("NIT-9");
        }

        @Test
        void run_shouldAbsorbChunkFailure_andStillStructure() {
            String text = clauses(49);
            capability.when("Clause 015", prompt -> {
                        throw new IllegalStateException("timeout");
                    })
                    .when(TestClients.MICRO_PROMPT, "plain text summary")
                    .when(TestClients.FINAL_PROMPT, "{\"tender_meta\": {\"tender_id\": \"NIT-9\"}}");
            ExtractionPipelineOrchestrator pipeline = orchestrator(fixedRules, noCriticalFields)
                    .singlePassTokenLimit(100)
                    .build();

            ExtractionResult result = pipeline.run(List.of(Document.of("tender.txt", text)));

            String finalPrompt = capability.prompts().stream()
                    .filter(p -> p.contains(TestClients.FINAL_PROMPT)).findFirst().orElseThrow();
            assertThat(finalPrompt)
                    .contains("--- CHUNK 1 ---\nplain text summary")
                    .contains("[CHUNK 2 extraction failed:");
            assertThat(result.record().text("tender_meta.tender_id")).isEqualTo("NIT-9");
        }
    }

    @Nested
    @DisplayName("Failures and envelope")
    class FailuresAndEnvelope {

        @Test
        void run_shouldPropagateFailure_andClearMdc_whenSinglePassUnavailable() {
            capability.when(TestClients.SINGLE_PASS_PROMPT, prompt -> {
                throw new IllegalStateException("502 Bad Gateway");
            });
            ExtractionPipelineOrchestrator pipeline = orchestrator(fixedRules, noCriticalFields).build();

            assertThatThrownBy(() -> pipeline.run(List.of(Document.of("a.txt", "short tender"))))
                    .isInstanceOfSatisfying(CapabilityUnavailableException.class,
                            e -> assertThat(e.getCallName()).isEqualTo(ExtractionPipelineOrchestrator.SINGLE_PASS_CALL));
            assertThat(MDC.get(ExtractionPipelineOrchestrator.MDC_RUN_ID)).isNull();
            assertThat(MDC.get(ExtractionPipelineOrchestrator.MDC_STAGE)).isNull();
        }

        @Test
        void run_shouldRejectEmptyInput() {
            ExtractionPipelineOrchestrator pipeline = orchestrator(fixedRules, noCriticalFields).build();

            assertThatThrownBy(() -> pipeline.run(List.of())).isInstanceOf(IllegalArgumentException.class);
            assertThat(capability.callCount()).isZero();
        }

        @Test
        void result_shouldRenderCleanRecordWithMetadata() throws Exception {
            capability.when(TestClients.SINGLE_PASS_PROMPT,
                    "{\"tender_meta\": {\"tender_id\": \"NIT-7\", \"department\": \"Not Found\"}}");
            ExtractionPipelineOrchestrator pipeline = orchestrator(fixedRules, noCriticalFields).build();

            ExtractionResult result = pipeline.run(List.of(
                    Document.of("a.txt", "first file"), Document.of("b.txt", "second file")));
            JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result));

            assertThat(json.at("/tender_meta/tender_id").asText()).isEqualTo("NIT-7");
            assertThat(json.at("/tender_meta/department").isMissingNode()).isTrue();
            assertThat(json.has("scope_of_work")).isFalse();
            assertThat(json.at("/_metadata/strategy").asText()).isEqualTo("single_pass");
            assertThat(json.at("/_metadata/document_type").asText()).isEqualTo("Generic");
            assertThat(json.at("/_metadata/files_processed/1").asText()).isEqualTo("b.txt");
            assertThat(json.at("/_metadata/validation/is_valid").asBoolean()).isFalse();
            assertThat(json.at("/_metadata/validation/missing_fields").size()).isEqualTo(2);
            assertThat(json.at("/_metadata/remaining_gaps/critical_missing").asInt()).isZero();
            assertThat(json.at("/_metadata/remaining_gaps/by_section/scope_of_work").asInt()).isPositive();
        }

        @Test
        void combine_shouldBannerEachDocument() {
            String combined = ExtractionPipelineOrchestrator.combine(List.of(
                    Document.of("a.txt", "alpha"), Document.of("b.txt", "beta")));

            assertThat(combined).isEqualTo("\n\n=== a.txt ===\nalpha\n\n=== b.txt ===\nbeta");
        }
    }
}
