package com.eainde.extraction.gap;

import com.eainde.extraction.model.FieldPath;

/**
 * An empty or placeholder-valued field found by a gap scan.
 */
public record MissingField(String section, String field, FieldPath path, boolean critical) {
}
