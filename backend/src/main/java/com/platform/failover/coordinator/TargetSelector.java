package com.platform.failover.coordinator;

import com.platform.failover.connectors.ReplicationLagProvider;
import com.platform.failover.error.InfrastructureApiException;
import com.platform.failover.model.Region;
import com.platform.failover.model.RegionDefinition;
import com.platform.failover.model.RegionRole;
import com.platform.failover.model.RegionState;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.state.RegionStateStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses the failover target of a service: the first candidate in priority order that is
 * healthy, not cold, and within the service's RPO.
 */
@Slf4j
public class TargetSelector {
    
    public record Rejection(String regionId, String reason) {}
    
    public record Selection(Optional<String> target, List<Rejection> rejections) {
        
        public Map<String, Object> rejectionsAsMetadata() {
            Map<String, Object> metadata = new LinkedHashMap<>();
            rejections.forEach(r -> metadata.put(r.regionId(), r.reason()));
            return metadata;
        }
    }
    
    private final RegionStateStore stateStore;
    private final ReplicationLagProvider lagProvider;
    
    public TargetSelector(RegionStateStore stateStore, ReplicationLagProvider lagProvider) {
        this.stateStore = stateStore;
        this.lagProvider = lagProvider;
    }
    
    /**
     * Automatic selection. Never returns a candidate whose replication lag exceeds the RPO
     * or cannot be read.
     */
    public Selection select(ServiceDefinition service, String currentPrimary) {
        List<Rejection> rejections = new ArrayList<>();
        
        for (RegionDefinition candidate : service.regions()) {
            String regionId = candidate.regionId();
            if (regionId.equals(currentPrimary)) {
                continue;
            }
            Region region = stateStore.get(service.serviceId(), regionId);
            if (region.role() == RegionRole.COLD) {
                rejections.add(new Rejection(regionId, "cold standby"));
                continue;
            }
            if (region.state() != RegionState.HEALTHY) {
                rejections.add(new Rejection(regionId, "state " + region.state()));
                continue;
            }
            
            Duration lag;
            try {
                lag = lagProvider.replicationLag(service.serviceId(), regionId);
            } catch (InfrastructureApiException e) {
                rejections.add(new Rejection(regionId, "replication lag unavailable: " + e.getMessage()));
                continue;
            }
            if (lag.compareTo(service.rpo()) > 0) {
                rejections.add(new Rejection(regionId,
                    String.format("replication lag %ds exceeds RPO %ds", lag.toSeconds(), service.rpo().toSeconds())));
                continue;
            }
            
            log.debug("Selected {} for {} (lag {}ms)", regionId, service.serviceId(), lag.toMillis());
            return new Selection(Optional.of(regionId), rejections);
        }
        return new Selection(Optional.empty(), rejections);
    }
    
    /**
     * Selection for an operator-forced failover: the named region if given, otherwise the first
     * healthy non-cold candidate. Replication lag is not consulted.
     */
    public Selection selectForced(ServiceDefinition service, String currentPrimary, String namedTarget) {
        List<Rejection> rejections = new ArrayList<>();
        
        if (namedTarget != null) {
            if (namedTarget.equals(currentPrimary)) {
                rejections.add(new Rejection(namedTarget, "already primary"));
            } else if (service.region(namedTarget).isEmpty()) {
                rejections.add(new Rejection(namedTarget, "not a region of " + service.serviceId()));
            } else {
                return new Selection(Optional.of(namedTarget), rejections);
            }
            return new Selection(Optional.empty(), rejections);
        }
        
        for (RegionDefinition candidate : service.regions()) {
            String regionId = candidate.regionId();
            if (regionId.equals(currentPrimary)) {
                continue;
            }
            Region region = stateStore.get(service.serviceId(), regionId);
            if (region.role() == RegionRole.COLD) {
                rejections.add(new Rejection(regionId, "cold standby must be named explicitly"));
            } else if (region.state() != RegionState.HEALTHY) {
                rejections.add(new Rejection(regionId, "state " + region.state()));
            } else {
                return new Selection(Optional.of(regionId), rejections);
            }
        }
        return new Selection(Optional.empty(), rejections);
    }
}
