package com.eainde.extraction.fanout;

import com.eainde.extraction.budget.RateBudgetController;
import com.eainde.extraction.chunk.Chunk;
import com.eainde.extraction.chunk.TokenEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * MAP phase: runs an extraction over every chunk under a concurrency ceiling.
 *
 * <pre>
 * extractAll(chunks, fn, maxConcurrency)
 *   per chunk (at most maxConcurrency in flight):
 *     acquire permit → reserve rate budget → fn(chunk) → release permit
 *     failure → "[CHUNK n extraction failed: reason]"
 *   wait for all → results in input order
 * </pre>
 *
 * <p>A failing chunk never cancels its siblings; the batch always yields one
 * result per chunk.</p>
 */
public class FanOutExtractor {

    private static final Logger log = LoggerFactory.getLogger(FanOutExtractor.class);

    public static final int DEFAULT_MAX_CONCURRENCY = 20;

    /** Tokens reserved on top of the chunk estimate for prompt framing and the answer. */
    static final int RESPONSE_TOKEN_ALLOWANCE = 1000;

    private final RateBudgetController rateBudget;
    private final Executor executor;

    public FanOutExtractor(RateBudgetController rateBudget, Executor executor) {
        this.rateBudget = rateBudget;
        this.executor = executor;
    }

    public List<String> extractAll(List<Chunk> chunks, ChunkExtraction extractFn) {
        return extractAll(chunks, extractFn, DEFAULT_MAX_CONCURRENCY);
    }

    public List<String> extractAll(List<Chunk> chunks, ChunkExtraction extractFn, int maxConcurrency) {
        if (maxConcurrency < 1) throw new IllegalArgumentException("maxConcurrency must be >= 1");
        log.info("MAP phase — extracting {} chunks (max {} in flight)", chunks.size(), maxConcurrency);

        Semaphore permits = new Semaphore(maxConcurrency, true);
        List<CompletableFuture<String>> futures = chunks.stream()
                .map(chunk -> CompletableFuture.supplyAsync(
                        () -> extractOne(chunk, extractFn, permits), executor))
                .toList();

        List<String> results = futures.stream().map(CompletableFuture::join).toList();

        long failed = results.stream().filter(FanOutExtractor::isFailureMarker).count();
        log.info("MAP phase complete — {} chunks, {} failed", results.size(), failed);
        return results;
    }

    private String extractOne(Chunk chunk, ChunkExtraction extractFn, Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failureMarker(chunk, "interrupted before start");
        }
        try {
            rateBudget.reserve(TokenEstimator.estimate(chunk.text()) + RESPONSE_TOKEN_ALLOWANCE);
            String result = extractFn.extract(chunk);
            log.debug("{} extracted", chunk);
            return result == null ? "" : result;
        } catch (Exception e) {
            log.warn("{} extraction failed: {}", chunk, e.getMessage());
            return failureMarker(chunk, e.getMessage());
        } finally {
            permits.release();
        }
    }

    static String failureMarker(Chunk chunk, String reason) {
        return "[" + chunk.label() + " extraction failed: " + (reason == null ? "unknown error" : reason) + "]";
    }

    public static boolean isFailureMarker(String result) {
        return result != null && result.startsWith("[CHUNK ") && result.contains(" extraction failed: ");
    }
}
