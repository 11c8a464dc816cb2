package com.eainde.extraction.capability;

/**
 * The external text-understanding capability: a prompt in, a best-effort
 * (usually JSON, possibly fenced or malformed) answer out.
 */
@FunctionalInterface
public interface ExtractionCapability {

    /**
     * @throws com.eainde.extraction.exception.TransientCapabilityException on retryable failures
     */
    String call(String prompt);
}
