package com.eainde.extraction.rules;

/**
 * Deterministic pre-extraction of fields that can be read straight off the
 * text. Results seed every prompt and fill leaves the model leaves empty.
 */
@FunctionalInterface
public interface RuleFieldExtractor {

    RuleExtraction extract(String text);
}
