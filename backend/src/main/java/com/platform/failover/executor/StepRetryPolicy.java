package com.platform.failover.executor;

import com.platform.failover.model.FailoverThresholds;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff with jitter for step attempts.
 */
public record StepRetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    double multiplier,
    Duration maxBackoff,
    Duration stepTimeout,
    double jitterFactor
) {
    
    public static final double DEFAULT_JITTER = 0.1;
    
    public static StepRetryPolicy from(FailoverThresholds thresholds) {
        return new StepRetryPolicy(
            thresholds.maxStepAttempts(),
            thresholds.initialBackoff(),
            thresholds.backoffMultiplier(),
            thresholds.maxBackoff(),
            thresholds.stepTimeout(),
            DEFAULT_JITTER
        );
    }
    
    /**
     * Delay before the attempt following {@code attempt} (1-based).
     */
    public Duration delayAfter(int attempt) {
        double exponential = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
        long base = Math.min((long) exponential, maxBackoff.toMillis());
        if (jitterFactor <= 0) {
            return Duration.ofMillis(base);
        }
        
        long jitter = (long) (base * jitterFactor * ThreadLocalRandom.current().nextDouble());
        long delay = ThreadLocalRandom.current().nextBoolean()
            ? Math.min(base + jitter, maxBackoff.toMillis())
            : Math.max(initialBackoff.toMillis(), base - jitter);
        return Duration.ofMillis(delay);
    }
}
