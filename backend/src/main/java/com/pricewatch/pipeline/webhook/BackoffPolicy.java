package com.pricewatch.pipeline.webhook;

import com.pricewatch.config.PipelineProperties;

import java.time.Duration;

/**
 * Retry curve for webhook deliveries: the n-th retry waits {@code base * factor^(n-1)}, capped at {@code cap}.
 * A delivery is exhausted once it has been attempted {@code maxAttempts} times.
 */
public record BackoffPolicy(Duration base, double factor, Duration cap, int maxAttempts) {

    public BackoffPolicy {
        if (base == null || base.isNegative()) {
            throw new IllegalArgumentException("base must be zero or positive");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be at least 1");
        }
        if (cap == null || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("cap must not be below base");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofSeconds(5), 2.0, Duration.ofMinutes(5), 5);
    }

    public static BackoffPolicy from(PipelineProperties.Webhooks properties) {
        long base = properties.getBackoffBaseSeconds();
        return new BackoffPolicy(
            Duration.ofSeconds(base),
            properties.getBackoffFactor(),
            Duration.ofSeconds(Math.max(base, properties.getBackoffMaxSeconds())),
            properties.getMaxAttempts()
        );
    }

    /**
     * @param attemptsMade attempts already made, including the one that just failed
     */
    public Duration delayBeforeRetry(int attemptsMade) {
        int exponent = Math.max(0, attemptsMade - 1);
        double millis = base.toMillis() * Math.pow(factor, exponent);
        if (Double.isInfinite(millis) || millis >= cap.toMillis()) {
            return cap;
        }
        return Duration.ofMillis((long) millis);
    }

    public boolean isExhausted(int attemptsMade) {
        return attemptsMade >= maxAttempts;
    }
}
