package com.eainde.extraction.chunk;

import com.eainde.extraction.model.FieldValue;
import com.eainde.extraction.model.TextValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkPlannerTest {

    private final ChunkPlanner planner = ChunkPlanner.builder()
            .maxChunkChars(8000)
            .objectMapper(new ObjectMapper())
            .build();

    private static String join(List<Chunk> chunks) {
        return String.join("\n", chunks.stream().map(Chunk::text).toList());
    }

    @Nested
    @DisplayName("splitToChunks()")
    class Split {

        @ParameterizedTest(name = "maxSize={0}")
        @ValueSource(ints = {1, 7, 40, 100, 1000, 100_000})
        @DisplayName("joining chunks reproduces the input exactly")
        void splitToChunks_shouldBeLossless_forRandomText(int maxSize) {
            Random random = new Random(maxSize);
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < 300; i++) {
                int length = random.nextInt(60);
                for (int j = 0; j < length; j++) {
                    text.append((char) ('a' + random.nextInt(26)));
                }
                text.append(random.nextInt(10) == 0 ? "\n\n" : "\n");
            }

            List<Chunk> chunks = planner.splitToChunks(text.toString(), maxSize);

            assertThat(join(chunks)).isEqualTo(text.toString());
        }

        @Test
        @DisplayName("keeps multi-line chunks within maxSize")
        void splitToChunks_shouldRespectMaxSize_whenLinesAreShort() {
            String text = String.join("\n", Collections.nCopies(100, "0123456789"));

            List<Chunk> chunks = planner.splitToChunks(text, 55);

            assertThat(chunks).hasSize(20);
            assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.text().length()).isLessThanOrEqualTo(55));
            for (int i = 0; i < chunks.size(); i++) {
                assertThat(chunks.get(i).index()).isEqualTo(i);
            }
        }

        @Test
        @DisplayName("puts a line longer than maxSize in a chunk of its own")
        void splitToChunks_shouldIsolateLongLine_whenLineExceedsMaxSize() {
            String longLine = "x".repeat(50);
            String text = "short\n" + longLine + "\nshort";

            List<Chunk> chunks = planner.splitToChunks(text, 20);

            assertThat(chunks).extracting(Chunk::text).containsExactly("short", longLine, "short");
        }

        @Test
        @DisplayName("returns a single empty chunk for empty input")
        void splitToChunks_shouldReturnSingleChunk_whenTextIsEmpty() {
            assertThat(planner.splitToChunks("", 10)).containsExactly(new Chunk(0, ""));
        }

        @Test
        void splitToChunks_shouldRejectNonPositiveMaxSize() {
            assertThatThrownBy(() -> planner.splitToChunks("abc", 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("needsChunking() and filterRelevantLines()")
    class Sizing {

        @Test
        void needsChunking_shouldCompareEstimateAgainstCeiling() {
            String text = "a".repeat(400);  // 100 tokens

            assertThat(planner.needsChunking(text, 100)).isFalse();
            assertThat(planner.needsChunking(text, 99)).isTrue();
        }

        @Test
        void filterRelevantLines_shouldStripAndDropBlankLines() {
            assertThat(ChunkPlanner.filterRelevantLines("  a  \n\n   \n\tb\n"))
                    .isEqualTo("a\nb");
        }
    }

    @Nested
    @DisplayName("buildCondensedContext()")
    class Condensed {

        private final Map<String, FieldValue> preExtracted = Map.of("emd", TextValue.of("₹50,000"));

        @Test
        @DisplayName("uses header plus the full text when it fits the budget")
        void buildCondensedContext_shouldEmbedFullText_whenUnderBudget() {
            String text = "Tender for supply of laptops\nEMD: 50000";

            String context = planner.buildCondensedContext(text, preExtracted, Map.of(), 15_000);

            assertThat(context).isEqualTo(planner.preExtractedHeader(preExtracted)
                    + ChunkPlanner.FULL_DOCUMENT_HEADER + text + "\n");
            assertThat(context).startsWith(ChunkPlanner.PRE_EXTRACTED_HEADER).contains("₹50,000");
        }

        @Test
        @DisplayName("samples sections by weight and truncates the middle of long ones")
        void buildCondensedContext_shouldSampleSections_whenOverBudget() {
            String text = "z".repeat(8_000);  // 2000 tokens, over 90% of 1000
            String eligibility = "E".repeat(1_000) + "MIDDLE" + "e".repeat(1_000);
            Map<String, String> sections = new LinkedHashMap<>();
            sections.put("financial", "EMD 50000");
            sections.put("eligibility", eligibility);

            String context = planner.buildCondensedContext(text, Map.of(), sections, 1_000);

            assertThat(context).doesNotContain(ChunkPlanner.FULL_DOCUMENT_HEADER);
            assertThat(context).contains("=== ELIGIBILITY CRITERIA ===", ChunkPlanner.TRUNCATION_MARKER);
            assertThat(context).doesNotContain("MIDDLE");
            assertThat(context).contains("\n=== FINANCIAL REQUIREMENTS ===\nEMD 50000\n");
            assertThat(context.indexOf("ELIGIBILITY")).isLessThan(context.indexOf("FINANCIAL"));
            assertThat(context).doesNotContain("SCOPE OF WORK");
        }

        @Test
        void headAndTail_shouldKeepBothEnds() {
            assertThat(ChunkPlanner.headAndTail("abcdefghij", 4))
                    .isEqualTo("ab" + ChunkPlanner.TRUNCATION_MARKER + "ij");
            assertThat(ChunkPlanner.headAndTail("abc", 4)).isEqualTo("abc");
        }
    }
}
