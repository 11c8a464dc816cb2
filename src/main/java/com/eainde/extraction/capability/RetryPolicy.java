package com.eainde.extraction.capability;

import com.eainde.extraction.budget.Sleeper;
import com.eainde.extraction.exception.TransientCapabilityException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff around a single capability call.
 *
 * <pre>
 * delay(attempt) = baseDelay * 2^(attempt-1) + jitter  (+ rateLimitPenalty when throttled)
 * </pre>
 *
 * <p>Failures are returned as a {@link CallResult}, never thrown, so callers
 * decide whether a failure is fatal or absorbed.</p>
 */
@Slf4j
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration rateLimitPenalty;
    private final Duration maxJitter;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration rateLimitPenalty, Duration maxJitter) {
        this(maxAttempts, baseDelay, rateLimitPenalty, maxJitter, Sleeper.SYSTEM,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration rateLimitPenalty, Duration maxJitter,
                       Sleeper sleeper, DoubleSupplier random) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.rateLimitPenalty = rateLimitPenalty;
        this.maxJitter = maxJitter;
        this.sleeper = sleeper;
        this.random = random;
    }

    /** 5 attempts, 2 s base, 1 s jitter, 5 s penalty on throttling. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofSeconds(2), Duration.ofSeconds(5), Duration.ofSeconds(1));
    }

    public <T> CallResult<T> execute(String callName, Callable<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return CallResult.success(call.call(), attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CallResult.failure(e, attempt);
            } catch (Exception e) {
                if (attempt >= maxAttempts) {
                    log.error("Call '{}' failed after {} attempts: {}", callName, attempt, e.getMessage());
                    return CallResult.failure(e, attempt);
                }
                Duration delay = delayFor(attempt, isRateLimited(e));
                log.warn("Call '{}' failed (attempt {}/{}), retrying in {} ms: {}",
                        callName, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return CallResult.failure(e, attempt);
                }
            }
        }
    }

    Duration delayFor(int attempt, boolean rateLimited) {
        long base = baseDelay.toMillis() << (attempt - 1);
        long jitter = (long) (random.getAsDouble() * maxJitter.toMillis());
        long penalty = rateLimited ? rateLimitPenalty.toMillis() : 0;
        return Duration.ofMillis(base + jitter + penalty);
    }

    private static boolean isRateLimited(Exception e) {
        if (e instanceof TransientCapabilityException transientError) {
            return transientError.isRateLimited();
        }
        return ChatModelExtractionCapability.isRateLimit(e);
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
