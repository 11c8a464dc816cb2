package com.eainde.extraction.capability;

import com.eainde.extraction.budget.RateBudgetController;
import com.eainde.extraction.chunk.TokenEstimator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Single entry point for capability calls: rate-budget admission, bounded
 * retries and JSON recovery.
 *
 * <pre>
 * reserve(estimate(prompt) + overhead) → retry(capability.call) → parse
 * </pre>
 */
@Slf4j
public class ExtractionClient {

    private final ExtractionCapability capability;
    private final RateBudgetController rateBudget;
    private final RetryPolicy retryPolicy;
    private final JsonResponseParser parser;

    public ExtractionClient(ExtractionCapability capability,
                            RateBudgetController rateBudget,
                            RetryPolicy retryPolicy,
                            JsonResponseParser parser) {
        this.capability = capability;
        this.rateBudget = rateBudget;
        this.retryPolicy = retryPolicy;
        this.parser = parser;
    }

    /**
     * Reserves budget for the prompt plus {@code responseTokens}, then calls with retries.
     */
    public CallResult<String> call(String callName, String prompt, int responseTokens) {
        rateBudget.reserve(TokenEstimator.estimate(prompt) + responseTokens);
        return callPreReserved(callName, prompt);
    }

    /**
     * Calls with retries, for callers that already reserved budget themselves.
     */
    public CallResult<String> callPreReserved(String callName, String prompt) {
        log.debug("Calling extraction capability '{}' ({} chars)", callName, prompt.length());
        return retryPolicy.execute(callName, () -> capability.call(prompt));
    }

    /**
     * A required call: exhausting retries or an unrecoverable answer is fatal.
     *
     * @throws com.eainde.extraction.exception.CapabilityUnavailableException  when retries are exhausted
     * @throws com.eainde.extraction.exception.MalformedExtractionException    when the answer is not JSON
     */
    public JsonNode callForJson(String callName, String prompt, int responseTokens) {
        String response = call(callName, prompt, responseTokens).orElseThrow(callName);
        return parser.parse(response);
    }

    public JsonResponseParser parser() {
        return parser;
    }
}
