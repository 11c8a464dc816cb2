package com.eainde.extraction.budget;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Dual-dimension admission control in front of every extraction call.
 *
 * <p>Holds a request bucket and a token bucket, both expressed as per-minute
 * budgets refilled continuously. {@link #reserve(int, long)} blocks the calling
 * thread until both buckets can pay, then debits both in one critical section.</p>
 *
 * <pre>
 * available = min(capacity, available + elapsedSeconds * capacity / 60)
 * </pre>
 *
 * <p>Waiters queue on a fair lock, so admission is roughly first come, first
 * served. One instance is shared by all concurrent runs of the process.</p>
 */
@Slf4j
public class RateBudgetController {

    private static final Duration MIN_WAIT = Duration.ofMillis(100);
    private static final Duration WAIT_SLACK = Duration.ofMillis(50);

    private final TokenBucket requests;
    private final TokenBucket tokens;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock(true);

    public RateBudgetController(int requestsPerMinute, long tokensPerMinute) {
        this(requestsPerMinute, tokensPerMinute, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public RateBudgetController(int requestsPerMinute, long tokensPerMinute, Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
        long now = clock.millis();
        this.requests = new TokenBucket(requestsPerMinute, now);
        this.tokens = new TokenBucket(tokensPerMinute, now);
    }

    /**
     * Reserves one request plus {@code tokenCost} tokens.
     */
    public void reserve(long tokenCost) {
        reserve(1, tokenCost);
    }

    /**
     * Blocks until both budgets can cover the cost, then debits both.
     *
     * <p>Never fails for lack of capacity. A cost above a bucket's capacity is
     * charged as the full capacity so oversized prompts cannot starve forever.
     * The lock is released while sleeping, so other callers and the
     * {@code available*} readers are never parked behind a waiter.</p>
     *
     * @throws CancellationException if the waiting thread is interrupted
     */
    public void reserve(int requestCost, long tokenCost) {
        double requestCharge = requests.cap(Math.max(0, requestCost));
        double tokenCharge = tokens.cap(Math.max(0, tokenCost));
        try {
            while (true) {
                Duration wait;
                lock.lockInterruptibly();
                try {
                    long now = clock.millis();
                    requests.refill(now);
                    tokens.refill(now);

                    if (requests.canAfford(requestCharge) && tokens.canAfford(tokenCharge)) {
                        requests.debit(requestCharge);
                        tokens.debit(tokenCharge);
                        return;
                    }

                    double waitSeconds = Math.max(
                            requests.secondsUntil(requestCharge),
                            tokens.secondsUntil(tokenCharge));
                    wait = Duration.ofMillis((long) Math.ceil(waitSeconds * 1000)).plus(WAIT_SLACK);
                    if (wait.compareTo(MIN_WAIT) < 0) {
                        wait = MIN_WAIT;
                    }
                } finally {
                    lock.unlock();
                }
                // Sleep outside the lock; both buckets are re-checked on wake-up.
                log.debug("Rate budget exhausted (requests={}, tokens={}); waiting {} ms",
                        requestCharge, tokenCharge, wait.toMillis());
                sleeper.sleep(wait);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting for rate budget");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    public double availableRequests() {
        return snapshot(requests);
    }

    public double availableTokens() {
        return snapshot(tokens);
    }

    private double snapshot(TokenBucket bucket) {
        lock.lock();
        try {
            bucket.refill(clock.millis());
            return bucket.available();
        } finally {
            lock.unlock();
        }
    }
}
