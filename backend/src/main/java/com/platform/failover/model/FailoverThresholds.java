package com.platform.failover.model;

import java.time.Duration;

/**
 * Effective thresholds for one service after applying per-service overrides to the
 * fleet defaults.
 */
public record FailoverThresholds(
    Duration probeInterval,
    Duration probeTimeout,
    int failuresToDegrade,
    Duration failureInterval,
    int successesToRecover,
    double suspectBurnRate,
    double hardBurnRate,
    Duration shortWindow,
    Duration longWindow,
    int maxStepAttempts,
    Duration initialBackoff,
    double backoffMultiplier,
    Duration maxBackoff,
    Duration stepTimeout,
    int verificationProbes,
    Duration verificationInterval
) {
    
    public static FailoverThresholds defaults() {
        return new FailoverThresholds(
            Duration.ofSeconds(10),
            Duration.ofSeconds(2),
            3,
            Duration.ofSeconds(60),
            5,
            1.0,
            10.0,
            Duration.ofMinutes(5),
            Duration.ofDays(30),
            3,
            Duration.ofSeconds(1),
            2.0,
            Duration.ofSeconds(10),
            Duration.ofSeconds(30),
            5,
            Duration.ofSeconds(2)
        );
    }
}
