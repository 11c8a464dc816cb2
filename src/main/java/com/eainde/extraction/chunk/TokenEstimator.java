package com.eainde.extraction.chunk;

/**
 * Character-count token heuristic shared by strategy selection, context
 * budgeting and rate-budget reservations.
 */
public final class TokenEstimator {

    /** Average characters per token for English/mixed tender text. */
    public static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return text.length() / CHARS_PER_TOKEN;
    }
}
