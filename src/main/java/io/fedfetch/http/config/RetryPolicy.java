package io.fedfetch.http.config;

import java.time.Duration;

/**
 * Bounded exponential backoff for one logical download.
 * <p>
 * The delay after the attempt numbered {@code attempt} (1-indexed) is
 * {@code min(maxDelaySeconds, baseDelaySeconds * 2^(attempt - 1))}, so with a base of 2.5
 * and a maximum of 90 seconds the sequence is 2.5, 5, 10, 20, 40, 80, 90, 90, ...
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final double baseDelaySeconds;
    private final double maxDelaySeconds;

    public RetryPolicy(int maxAttempts, double baseDelaySeconds, double maxDelaySeconds) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (!(baseDelaySeconds >= 0) || Double.isInfinite(baseDelaySeconds)) {
            throw new IllegalArgumentException("baseDelaySeconds must be a finite non-negative number, was "
                + baseDelaySeconds);
        }
        if (!(maxDelaySeconds >= baseDelaySeconds) || Double.isInfinite(maxDelaySeconds)) {
            throw new IllegalArgumentException("maxDelaySeconds must be finite and not smaller than baseDelaySeconds, was "
                + maxDelaySeconds);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelaySeconds = baseDelaySeconds;
        this.maxDelaySeconds = maxDelaySeconds;
    }

    /**
     * A policy that makes exactly one attempt.
     */
    public static RetryPolicy noRetries() {
        return new RetryPolicy(1, 0, 0);
    }

    /**
     * Seconds to wait after the given failed attempt before starting the next one.
     *
     * @param attempt the 1-indexed number of the attempt that just failed
     */
    public double delaySeconds(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-indexed, was " + attempt);
        }
        // 2^1023 is the largest finite power; anything beyond is capped anyway
        double exponential = baseDelaySeconds * Math.pow(2, Math.min(attempt - 1, 1023));
        return Math.min(maxDelaySeconds, exponential);
    }

    public Duration delay(int attempt) {
        return Duration.ofNanos(Math.round(delaySeconds(attempt) * 1_000_000_000L));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public double getBaseDelaySeconds() {
        return baseDelaySeconds;
    }

    public double getMaxDelaySeconds() {
        return maxDelaySeconds;
    }

    @Override
    public String toString() {
        return String.format("RetryPolicy{maxAttempts=%d, baseDelaySeconds=%s, maxDelaySeconds=%s}",
                             maxAttempts, baseDelaySeconds, maxDelaySeconds);
    }
}
