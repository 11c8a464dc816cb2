package com.eainde.extraction.capability;

import com.eainde.extraction.exception.CapabilityUnavailableException;

import java.util.function.Function;

/**
 * Outcome of a retried call: either a value or the last error, plus the
 * number of attempts made.
 */
public record CallResult<T>(T value, Throwable error, int attempts) {

    public static <T> CallResult<T> success(T value, int attempts) {
        return new CallResult<>(value, null, attempts);
    }

    public static <T> CallResult<T> failure(Throwable error, int attempts) {
        return new CallResult<>(null, error, attempts);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the value, or {@code fallback} applied to the error
     */
    public T orElseGet(Function<Throwable, T> fallback) {
        return isSuccess() ? value : fallback.apply(error);
    }

    /**
     * @throws CapabilityUnavailableException if this call failed
     */
    public T orElseThrow(String callName) {
        if (isSuccess()) return value;
        throw new CapabilityUnavailableException(callName, attempts, error);
    }
}
