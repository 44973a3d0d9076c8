package com.eia.api.fetch;

import java.time.Duration;

import com.eia.api.exceptions.InvalidArgumentException;
import com.eia.api.exceptions.TransportFailureException;

/**
 * Bounded exponential backoff for a single chunk request. Only retryable
 * {@link TransportFailureException}s are retried.
 */
public final class RetryPolicy {

    private static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);

    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;

    private RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
    }

    /**
     * Single attempt, failures escalate immediately.
     */
    public static RetryPolicy none() {
        return NONE;
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialBackoff) {
        return exponential(maxAttempts, initialBackoff, DEFAULT_MULTIPLIER, DEFAULT_MAX_BACKOFF);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialBackoff, double multiplier,
            Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new InvalidArgumentException("Retry attempts must be at least 1, got: " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new InvalidArgumentException("Initial backoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new InvalidArgumentException("Backoff multiplier must be >= 1, got: " + multiplier);
        }
        if (maxAttempts == 1) {
            return NONE;
        }
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier,
                maxBackoff == null ? DEFAULT_MAX_BACKOFF : maxBackoff);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean shouldRetry(TransportFailureException failure, int attempt) {
        return attempt < maxAttempts && failure.isRetryable();
    }

    /**
     * Delay before the attempt following {@code attempt} (1-based).
     */
    public Duration backoffAfter(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }

    @Override
    public String toString() {
        return maxAttempts == 1 ? "RetryPolicy[none]"
                : "RetryPolicy[attempts=" + maxAttempts + ", initial=" + initialBackoff.toMillis()
                        + "ms, x" + multiplier + ", max=" + maxBackoff.toMillis() + "ms]";
    }
}
