package com.platform.failover.model;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A service under failover control. Immutable after load.
 * 
 * @param regions candidate regions in failover priority order
 */
public record ServiceDefinition(
    String serviceId,
    List<RegionDefinition> regions,
    SloTarget slo,
    Duration rto,
    Duration rpo,
    FailoverThresholds thresholds
) {
    
    public ServiceDefinition {
        regions = List.copyOf(regions);
    }
    
    public RegionDefinition configuredPrimary() {
        return regions.stream()
            .filter(r -> r.role() == RegionRole.PRIMARY)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Service " + serviceId + " has no primary region"));
    }
    
    public Optional<RegionDefinition> region(String regionId) {
        return regions.stream()
            .filter(r -> r.regionId().equals(regionId))
            .findFirst();
    }
    
    public List<String> regionIds() {
        return regions.stream().map(RegionDefinition::regionId).toList();
    }
}
