package com.strollie.planner.engine.resilience;

import com.strollie.planner.error.ConfigurationException;

import java.time.Duration;

/**
 * Retry/backoff settings for one wrapped operation.
 * <p>
 * The wait after failed attempt {@code n} is {@code baseDelay * backoffMultiplier^(n-1)}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double backoffMultiplier) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(1500);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new ConfigurationException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new ConfigurationException("baseDelay must be > 0, got " + baseDelay);
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new ConfigurationException("backoffMultiplier must be >= 1, got " + backoffMultiplier);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_BACKOFF_MULTIPLIER);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, DEFAULT_BASE_DELAY, 1.0);
    }

    public Duration backoffAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt starts at 1, got " + attempt);
        }
        double millis = baseDelay.toMillis() * Math.pow(backoffMultiplier, attempt - 1);
        return Duration.ofMillis(Math.round(millis));
    }

    /**
     * Upper bound on how long a resilient call may block its caller:
     * every attempt times out and every backoff is slept in full.
     * Callers must set their own outer deadline above this value, the engine cannot be cancelled.
     */
    public Duration worstCaseLatency(Duration perAttemptTimeout) {
        Duration total = perAttemptTimeout.multipliedBy(maxAttempts);
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            total = total.plus(backoffAfterAttempt(attempt));
        }
        return total;
    }
}
