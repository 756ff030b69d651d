package com.platform.failover.detector;

import com.platform.failover.model.RegionState;

/**
 * Hysteresis phases of one (service, region) pair. Finer grained than the stored
 * {@link RegionState}.
 */
public enum DetectorPhase {
    HEALTHY(RegionState.HEALTHY),
    SUSPECTED_DEGRADED(RegionState.DEGRADED),
    DEGRADED(RegionState.DEGRADED),
    UNREACHABLE(RegionState.UNREACHABLE),
    RECOVERING(RegionState.DEGRADED);
    
    private final RegionState regionState;
    
    DetectorPhase(RegionState regionState) {
        this.regionState = regionState;
    }
    
    public RegionState toRegionState() {
        return regionState;
    }
}
