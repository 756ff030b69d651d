package com.platform.failover.coordinator;

public enum CoordinatorState {
    STABLE,
    EVALUATING,
    FAILOVER_IN_PROGRESS,
    VERIFYING,
    ROLLING_BACK,
    ABORTED;
    
    /**
     * States in which a failover event is live.
     */
    public boolean hasLiveFailover() {
        return this == FAILOVER_IN_PROGRESS || this == VERIFYING || this == ROLLING_BACK;
    }
}
