package com.platform.failover.model;

import java.time.Duration;

/**
 * Service level objective: target success ratio and the latency above which a
 * successful request still counts against the budget.
 */
public record SloTarget(double ratio, Duration latencyCeiling) {
    
    /**
     * Fraction of events the objective allows to be bad.
     */
    public double allowedErrorRatio() {
        return 1.0 - ratio;
    }
    
    public boolean isGoodEvent(ProbeSample sample) {
        if (!sample.isSuccess()) {
            return false;
        }
        return latencyCeiling == null || sample.latency().compareTo(latencyCeiling) <= 0;
    }
}
