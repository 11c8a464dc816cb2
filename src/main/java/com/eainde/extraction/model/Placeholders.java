package com.eainde.extraction.model;

import java.util.Locale;
import java.util.Set;

/**
 * Placeholder tokens the extraction capability uses for "no data".
 */
public final class Placeholders {

    /** Tokens that mark a field as a gap. */
    public static final Set<String> GAP_TOKENS = Set.of(
            "", "not mentioned", "n/a", "not specified", "not available", "tbd");

    /** Tokens stripped from the externally visible record. Superset of {@link #GAP_TOKENS}. */
    public static final Set<String> CLEANUP_TOKENS = Set.of(
            "", "not mentioned", "n/a", "not specified", "not available", "tbd",
            "not found", "null", "none");

    private Placeholders() {
    }

    public static boolean isGapToken(String value) {
        return value == null || GAP_TOKENS.contains(normalize(value));
    }

    public static boolean isCleanupToken(String value) {
        return value == null || CLEANUP_TOKENS.contains(normalize(value));
    }

    private static String normalize(String value) {
        return value.strip().toLowerCase(Locale.ROOT);
    }
}
