package com.platform.clusterchaos.core;

import com.platform.clusterchaos.config.HarnessProperties;

import java.time.Duration;

/**
 * Bounded exponential backoff: the delay after failed attempt k (0-based) is
 * {@code min(initialDelay * multiplier^k, maxDelay)}, and at most {@code maxAttempts} probes are made.
 */
public record BackoffPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {

    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays cannot be negative");
        }
    }

    public static BackoffPolicy from(HarnessProperties.Health health) {
        return new BackoffPolicy(health.tries(), health.initialDelay(), health.multiplier(), health.maxDelay());
    }

    /**
     * Delay to wait after the given failed attempt.
     */
    public Duration delayAfter(int attempt) {
        double exponentialDelay = initialDelay.toMillis() * Math.pow(multiplier, attempt);
        long cappedDelay = (long) Math.min(exponentialDelay, (double) maxDelay.toMillis());
        return Duration.ofMillis(cappedDelay);
    }

    /**
     * Upper bound on total sleep time for one polling loop: {@code Σ min(d·b^k, c)} for k = 0..T-1.
     * The engine never sleeps after the final attempt, so actual waits stay below this.
     */
    public Duration worstCaseWait() {
        Duration total = Duration.ZERO;
        for (int k = 0; k < maxAttempts; k++) {
            total = total.plus(delayAfter(k));
        }
        return total;
    }
}
