package com.eainde.extraction.exception;

/**
 * A capability call failed in a way that is worth retrying.
 *
 * <p>{@code rateLimited} marks failures where the capability itself pushed
 * back (HTTP 429 or equivalent); those get an extra backoff penalty.</p>
 */
public class TransientCapabilityException extends ExtractionException {

    private final boolean rateLimited;

    public TransientCapabilityException(String message, boolean rateLimited) {
        super(message);
        this.rateLimited = rateLimited;
    }

    public TransientCapabilityException(String message, boolean rateLimited, Throwable cause) {
        super(message, cause);
        this.rateLimited = rateLimited;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }
}
