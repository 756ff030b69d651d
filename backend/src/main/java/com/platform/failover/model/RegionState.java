package com.platform.failover.model;

/**
 * Believed state of a region for one service, as held by the region state store.
 * 
 * HEALTHY, DEGRADED and UNREACHABLE are written by the failure detector;
 * PROMOTING, PROMOTED and FAILED are written by the failover executor.
 */
public enum RegionState {
    HEALTHY,
    DEGRADED,
    UNREACHABLE,
    PROMOTING,
    PROMOTED,
    FAILED;
    
    /**
     * States owned by an in-flight promotion; the detector does not overwrite them.
     */
    public boolean isOwnedByExecutor() {
        return this == PROMOTING || this == PROMOTED;
    }
}
