package com.eainde.extraction.exception;

/**
 * Base type for failures raised by the extraction pipeline.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
