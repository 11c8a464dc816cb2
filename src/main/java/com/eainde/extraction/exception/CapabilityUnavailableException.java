package com.eainde.extraction.exception;

/**
 * A required capability call exhausted its retry budget. Fatal for the run.
 */
public class CapabilityUnavailableException extends ExtractionException {

    private final String callName;
    private final int attempts;

    public CapabilityUnavailableException(String callName, int attempts, Throwable cause) {
        super(String.format("Extraction call '%s' failed after %d attempt(s): %s",
                callName, attempts, cause != null ? cause.getMessage() : "unknown"), cause);
        this.callName = callName;
        this.attempts = attempts;
    }

    public String getCallName() {
        return callName;
    }

    public int getAttempts() {
        return attempts;
    }
}
