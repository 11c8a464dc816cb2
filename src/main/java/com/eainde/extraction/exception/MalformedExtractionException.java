package com.eainde.extraction.exception;

/**
 * The capability answered, but the answer could not be recovered into JSON.
 */
public class MalformedExtractionException extends ExtractionException {

    private final String excerpt;

    public MalformedExtractionException(String excerpt, Throwable cause) {
        super("Invalid JSON response from extraction capability: " + excerpt + "...", cause);
        this.excerpt = excerpt;
    }

    public String getExcerpt() {
        return excerpt;
    }
}
