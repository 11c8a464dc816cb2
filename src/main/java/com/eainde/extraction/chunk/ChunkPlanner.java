package com.eainde.extraction.chunk;

import com.eainde.extraction.model.FieldValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Splits oversized documents into line-aligned chunks and builds budgeted,
 * condensed contexts for single-call extraction.
 *
 * <h3>Usage:</h3>
 * <pre>
 * ChunkPlanner planner = ChunkPlanner.builder()
 *         .maxChunkChars(8000)
 *         .objectMapper(objectMapper)
 *         .build();
 *
 * List&lt;Chunk&gt; chunks = planner.splitToChunks(text);
 * String context = planner.buildCondensedContext(text, ruleFields, sections, 15_000);
 * </pre>
 *
 * <p>Pure logic with no Spring dependencies.</p>
 */
public class ChunkPlanner {

    private static final Logger log = LoggerFactory.getLogger(ChunkPlanner.class);

    static final String PRE_EXTRACTED_HEADER = "=== PRE-EXTRACTED DATA ===\n";
    static final String FULL_DOCUMENT_HEADER = "=== COMPLETE TENDER DOCUMENT ===\n";
    static final String TRUNCATION_MARKER = "\n... [truncated] ...\n";

    /** The full text is used only while it stays under this share of the budget. */
    private static final double FULL_TEXT_MARGIN = 0.9;

    /** Tokens held back for section titles and prompt framing. */
    private static final int SECTION_OVERHEAD_TOKENS = 500;

    /** Characters granted per budgeted token when sizing section excerpts. */
    private static final int SECTION_CHARS_PER_TOKEN = 5;

    private final int maxChunkChars;
    private final ObjectMapper objectMapper;

    private ChunkPlanner(Builder builder) {
        this.maxChunkChars = builder.maxChunkChars;
        this.objectMapper = builder.objectMapper;
    }

    // =========================================================================
    //  Splitting
    // =========================================================================

    /**
     * @return true if the estimated token count of {@code text} exceeds {@code tokenCeiling};
     *         a text exactly at the ceiling still fits one call
     */
    public boolean needsChunking(String text, int tokenCeiling) {
        int estimated = TokenEstimator.estimate(text);
        boolean needs = estimated > tokenCeiling;
        if (needs) {
            log.debug("Document needs chunking: ~{} estimated tokens exceeds {} limit", estimated, tokenCeiling);
        }
        return needs;
    }

    public List<Chunk> splitToChunks(String text) {
        return splitToChunks(text, maxChunkChars);
    }

    /**
     * Accumulates whole lines into a chunk until the next line would push it
     * past {@code maxSize}, then starts a new chunk. Lines are never split, so
     * a single line longer than {@code maxSize} becomes a chunk of its own.
     *
     * <p>Joining the returned chunk texts with {@code \n} reproduces {@code text}.</p>
     *
     * @param text    the text to split
     * @param maxSize max characters per chunk, counting one separator per line
     * @return chunks in document order, never empty
     */
    public List<Chunk> splitToChunks(String text, int maxSize) {
        if (maxSize < 1) throw new IllegalArgumentException("maxSize must be >= 1");
        String source = text == null ? "" : text;

        List<Chunk> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentSize = 0;

        for (String line : source.split("\n", -1)) {
            if (currentSize + line.length() > maxSize && !current.isEmpty()) {
                chunks.add(new Chunk(chunks.size(), String.join("\n", current)));
                current = new ArrayList<>();
                currentSize = 0;
            }
            current.add(line);
            currentSize += line.length() + 1;
        }
        chunks.add(new Chunk(chunks.size(), String.join("\n", current)));

        log.debug("Split {} chars into {} chunks (maxSize={})", source.length(), chunks.size(), maxSize);
        return Collections.unmodifiableList(chunks);
    }

    /**
     * Strips every line and drops blank ones, shrinking the token count before
     * hierarchical extraction.
     */
    public static String filterRelevantLines(String text) {
        if (text == null || text.isEmpty()) return "";
        List<String> kept = new ArrayList<>();
        for (String line : text.split("\n")) {
            String stripped = line.strip();
            if (!stripped.isEmpty()) {
                kept.add(stripped);
            }
        }
        return String.join("\n", kept);
    }

    // =========================================================================
    //  Condensed context
    // =========================================================================

    /**
     * Builds the context for a single extraction call that must represent the
     * whole document.
     *
     * <p>When the full text fits in 90% of {@code budgetTokens}, the result is
     * the pre-extracted header followed by the text verbatim. Otherwise each
     * {@link ContextSection} present in {@code sectionMap} gets its weighted
     * share of the remaining budget; a section over its share keeps its head
     * and tail around a truncation marker.</p>
     */
    public String buildCondensedContext(String fullText,
                                        Map<String, FieldValue> preExtracted,
                                        Map<String, String> sectionMap,
                                        int budgetTokens) {
        String text = fullText == null ? "" : fullText;
        StringBuilder context = new StringBuilder(preExtractedHeader(preExtracted));

        if (TokenEstimator.estimate(text) < budgetTokens * FULL_TEXT_MARGIN) {
            context.append(FULL_DOCUMENT_HEADER).append(text).append('\n');
            return context.toString();
        }

        int available = budgetTokens - TokenEstimator.estimate(context.toString()) - SECTION_OVERHEAD_TOKENS;
        log.info("Document over context budget ({} tokens) — sampling {} sections from {} available tokens",
                budgetTokens, sectionMap.size(), available);

        for (ContextSection section : ContextSection.values()) {
            String content = sectionMap.get(section.key());
            if (content == null) continue;

            int limit = Math.max(0, (int) (available * section.weight() * SECTION_CHARS_PER_TOKEN));
            context.append("\n=== ").append(section.title()).append(" ===\n")
                    .append(headAndTail(content, limit))
                    .append('\n');
        }
        return context.toString();
    }

    /**
     * Renders the pre-extracted rule fields as the header every prompt starts with.
     */
    public String preExtractedHeader(Map<String, FieldValue> preExtracted) {
        return PRE_EXTRACTED_HEADER + toPrettyJson(preExtracted) + "\n\n";
    }

    static String headAndTail(String content, int limit) {
        if (content.length() <= limit) return content;
        int half = limit / 2;
        return content.substring(0, half) + TRUNCATION_MARKER + content.substring(content.length() - half);
    }

    private String toPrettyJson(Map<String, FieldValue> fields) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(fields == null ? Map.of() : fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pre-extracted fields", e);
        }
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a planner with default settings (8000-char chunks, plain ObjectMapper).
     */
    public static ChunkPlanner withDefaults() {
        return builder().build();
    }

    public static class Builder {
        private int maxChunkChars = 8000;
        private ObjectMapper objectMapper = new ObjectMapper();

        /**
         * Maximum characters per chunk. Default: 8000.
         */
        public Builder maxChunkChars(int maxChunkChars) {
            if (maxChunkChars < 1) throw new IllegalArgumentException("maxChunkChars must be >= 1");
            this.maxChunkChars = maxChunkChars;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public ChunkPlanner build() {
            return new ChunkPlanner(this);
        }
    }
}
