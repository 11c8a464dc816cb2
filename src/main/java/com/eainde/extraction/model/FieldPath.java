package com.eainde.extraction.model;

import java.util.Arrays;
import java.util.List;

/**
 * Dot-delimited address into the record tree, e.g. {@code key_dates.bid_end}.
 *
 * @param segments path segments from the root, never empty
 */
public record FieldPath(List<String> segments) {

    public static final String ROOT_SECTION = "root";

    public FieldPath {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("FieldPath needs at least one segment");
        }
        segments = List.copyOf(segments);
    }

    public static FieldPath parse(String dotted) {
        if (dotted == null || dotted.isBlank()) {
            throw new IllegalArgumentException("FieldPath must not be blank");
        }
        return new FieldPath(Arrays.asList(dotted.strip().split("\\.")));
    }

    public static FieldPath of(String... segments) {
        return new FieldPath(List.of(segments));
    }

    public FieldPath child(String segment) {
        String[] next = segments.toArray(new String[0]);
        next = Arrays.copyOf(next, next.length + 1);
        next[next.length - 1] = segment;
        return new FieldPath(Arrays.asList(next));
    }

    /** Last segment. */
    public String field() {
        return segments.get(segments.size() - 1);
    }

    /**
     * Immediate parent segment, or {@value #ROOT_SECTION} for a top-level field.
     */
    public String section() {
        return segments.size() == 1 ? ROOT_SECTION : segments.get(segments.size() - 2);
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
