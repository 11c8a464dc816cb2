package com.eainde.extraction.budget;

/**
 * One dimension of the rate budget: a per-minute capacity refilled continuously.
 *
 * <p>Not thread-safe. {@link RateBudgetController} guards every access.</p>
 */
final class TokenBucket {

    private final double capacity;
    private final double refillPerSecond;
    private double available;
    private long lastRefillMillis;

    TokenBucket(double capacityPerMinute, long nowMillis) {
        if (capacityPerMinute <= 0) {
            throw new IllegalArgumentException("capacityPerMinute must be > 0");
        }
        this.capacity = capacityPerMinute;
        this.refillPerSecond = capacityPerMinute / 60.0;
        this.available = capacityPerMinute;
        this.lastRefillMillis = nowMillis;
    }

    void refill(long nowMillis) {
        double elapsedSeconds = Math.max(0, nowMillis - lastRefillMillis) / 1000.0;
        available = Math.min(capacity, available + elapsedSeconds * refillPerSecond);
        lastRefillMillis = nowMillis;
    }

    /** Costs above capacity are charged as the full capacity. */
    double cap(double cost) {
        return Math.min(cost, capacity);
    }

    boolean canAfford(double cappedCost) {
        return available >= cappedCost;
    }

    void debit(double cappedCost) {
        available -= cappedCost;
    }

    /** Seconds until {@code cappedCost} becomes affordable, 0 if it already is. */
    double secondsUntil(double cappedCost) {
        double deficit = cappedCost - available;
        return deficit <= 0 ? 0 : deficit / refillPerSecond;
    }

    double available() {
        return available;
    }

    double capacity() {
        return capacity;
    }
}
