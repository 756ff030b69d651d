package com.platform.failover.model;

import java.time.Instant;

/**
 * Immutable snapshot of one (service, region) entry in the region state store.
 * Every accepted compare-and-set produces a new snapshot with a bumped version.
 */
public record Region(
    String serviceId,
    String regionId,
    RegionRole role,
    RegionState state,
    Instant lastProbeAt,
    int consecutiveFailures,
    long version
) {
    
    public static Region initial(String serviceId, String regionId, RegionRole role) {
        return new Region(serviceId, regionId, role, RegionState.HEALTHY, null, 0, 0L);
    }
    
    public Region withState(RegionState newState) {
        return new Region(serviceId, regionId, role, newState, lastProbeAt, consecutiveFailures, version);
    }
    
    public Region withRole(RegionRole newRole) {
        return new Region(serviceId, regionId, newRole, state, lastProbeAt, consecutiveFailures, version);
    }
    
    public Region withProbe(Instant probedAt, int failures) {
        return new Region(serviceId, regionId, role, state, probedAt, failures, version);
    }
    
    public Region withVersion(long newVersion) {
        return new Region(serviceId, regionId, role, state, lastProbeAt, consecutiveFailures, newVersion);
    }
}
