package com.platform.failover.model;

import java.time.Instant;

/**
 * Error budget of a service over one window, recomputed from the live sample window.
 */
public record ErrorBudget(
    String serviceId,
    String window,
    Instant windowStart,
    Instant windowEnd,
    long totalEvents,
    double allowedFailures,
    long consumedFailures,
    double burnRate
) {
    
    public double remainingFailures() {
        return Math.max(0.0, allowedFailures - consumedFailures);
    }
    
    public boolean isExhausted() {
        return totalEvents > 0 && consumedFailures >= allowedFailures;
    }
}
