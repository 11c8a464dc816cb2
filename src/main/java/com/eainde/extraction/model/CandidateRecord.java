package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.Optional;

/**
 * The structured tender record at any pipeline stage.
 *
 * <p>Immutable. Stages never edit a record in place; they return a new one.</p>
 */
public record CandidateRecord(@JsonValue SectionValue root) {

    public static final CandidateRecord EMPTY = new CandidateRecord(SectionValue.EMPTY);

    public CandidateRecord {
        Objects.requireNonNull(root, "root");
    }

    public Optional<FieldValue> get(FieldPath path) {
        FieldValue current = root;
        for (String segment : path.segments()) {
            if (!(current instanceof SectionValue section)) {
                return Optional.empty();
            }
            current = section.fields().get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public Optional<FieldValue> get(String dottedPath) {
        return get(FieldPath.parse(dottedPath));
    }

    /**
     * Text at {@code dottedPath}, or empty string when absent or not a text leaf.
     */
    public String text(String dottedPath) {
        return get(dottedPath)
                .filter(TextValue.class::isInstance)
                .map(v -> ((TextValue) v).value())
                .orElse("");
    }

    /**
     * @return a copy with {@code value} placed at {@code path}; missing or
     *         non-section intermediate nodes are replaced by sections
     */
    public CandidateRecord with(FieldPath path, FieldValue value) {
        return new CandidateRecord(put(root, path, 0, value));
    }

    private static SectionValue put(SectionValue section, FieldPath path, int depth, FieldValue value) {
        String key = path.segments().get(depth);
        if (depth == path.segments().size() - 1) {
            return section.with(key, value);
        }
        FieldValue child = section.fields().get(key);
        SectionValue childSection = child instanceof SectionValue s ? s : SectionValue.EMPTY;
        return section.with(key, put(childSection, path, depth + 1, value));
    }
}
