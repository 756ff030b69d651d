package com.platform.failover.state;

import com.platform.failover.config.Fleet;
import com.platform.failover.error.ConflictException;
import com.platform.failover.error.ErrorCode;
import com.platform.failover.error.ResourceNotFoundException;
import com.platform.failover.error.ValidationException;
import com.platform.failover.model.Region;
import com.platform.failover.model.RegionDefinition;
import com.platform.failover.model.RegionRole;
import com.platform.failover.model.RegionState;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Believed state of every (service, region) pair and the active primary of every service.
 * 
 * The only mutation paths are compare-and-set: a change is applied only when the caller's
 * expected value matches what is stored, otherwise {@link ConflictException} is thrown and
 * the caller must re-read.
 */
@Slf4j
@Component
public class RegionStateStore {
    
    private static final Map<RegionState, Set<RegionState>> ALLOWED_TRANSITIONS = Map.of(
        RegionState.HEALTHY, Set.of(RegionState.DEGRADED, RegionState.UNREACHABLE, RegionState.PROMOTING),
        RegionState.DEGRADED, Set.of(RegionState.HEALTHY, RegionState.UNREACHABLE, RegionState.PROMOTING),
        RegionState.UNREACHABLE, Set.of(RegionState.HEALTHY, RegionState.DEGRADED),
        RegionState.PROMOTING, Set.of(RegionState.PROMOTED, RegionState.FAILED),
        RegionState.PROMOTED, Set.of(RegionState.HEALTHY, RegionState.FAILED),
        RegionState.FAILED, Set.of(RegionState.HEALTHY, RegionState.DEGRADED, RegionState.UNREACHABLE, RegionState.PROMOTING)
    );
    
    private final Map<String, Region> regions = new ConcurrentHashMap<>();
    private final Map<String, String> primaries = new ConcurrentHashMap<>();
    private final Map<String, List<String>> regionOrder = new ConcurrentHashMap<>();
    private final MetricsRegistry metricsRegistry;
    
    public RegionStateStore(Fleet fleet, MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
        fleet.services().forEach(this::register);
    }
    
    private void register(ServiceDefinition service) {
        for (RegionDefinition definition : service.regions()) {
            regions.put(key(service.serviceId(), definition.regionId()),
                Region.initial(service.serviceId(), definition.regionId(), definition.role()));
        }
        regionOrder.put(service.serviceId(), service.regionIds());
        primaries.put(service.serviceId(), service.configuredPrimary().regionId());
        log.debug("Registered {} regions for service {}", service.regions().size(), service.serviceId());
    }
    
    public Region get(String serviceId, String regionId) {
        Region region = regions.get(key(serviceId, regionId));
        if (region == null) {
            throw ResourceNotFoundException.region(serviceId, regionId);
        }
        return region;
    }
    
    /**
     * All regions of a service in configured priority order.
     */
    public List<Region> regionsOf(String serviceId) {
        List<String> order = regionOrder.get(serviceId);
        if (order == null) {
            throw ResourceNotFoundException.service(serviceId);
        }
        List<Region> result = new ArrayList<>(order.size());
        for (String regionId : order) {
            result.add(get(serviceId, regionId));
        }
        return result;
    }
    
    public String primaryOf(String serviceId) {
        String primary = primaries.get(serviceId);
        if (primary == null) {
            throw ResourceNotFoundException.service(serviceId);
        }
        return primary;
    }
    
    /**
     * Apply {@code change} to the region if its stored state is still {@code expectedState}.
     * 
     * @return the stored snapshot after the change, with a bumped version
     * @throws ConflictException if the stored state no longer matches
     * @throws ValidationException if the change moves to a state not reachable from the current one
     */
    public Region compareAndSet(String serviceId, String regionId, RegionState expectedState,
                                UnaryOperator<Region> change) {
        String key = key(serviceId, regionId);
        get(serviceId, regionId);
        
        Region updated = regions.compute(key, (k, current) -> {
            if (current.state() != expectedState) {
                metricsRegistry.recordStateConflict(serviceId, regionId);
                throw new ConflictException(key, expectedState, current.state());
            }
            Region next = change.apply(current);
            if (next.state() != current.state() && !isTransitionAllowed(current.state(), next.state())) {
                throw new ValidationException(ErrorCode.STATE_TRANSITION_INVALID,
                    String.format("Region %s cannot move from %s to %s", key, current.state(), next.state()));
            }
            return next.withVersion(current.version() + 1);
        });
        
        if (updated.state() != expectedState) {
            log.info("Region {} state {} -> {}", key, expectedState, updated.state());
        }
        return updated;
    }
    
    /**
     * Shorthand for a pure state change.
     */
    public Region compareAndSetState(String serviceId, String regionId, RegionState expectedState,
                                     RegionState newState) {
        return compareAndSet(serviceId, regionId, expectedState, r -> r.withState(newState));
    }
    
    /**
     * Record probe bookkeeping without touching the state. Last writer wins.
     */
    public Region recordProbe(String serviceId, String regionId, Instant probedAt, int consecutiveFailures) {
        get(serviceId, regionId);
        return regions.computeIfPresent(key(serviceId, regionId),
            (k, current) -> current.withProbe(probedAt, consecutiveFailures).withVersion(current.version() + 1));
    }
    
    /**
     * Move the primary designation of a service from {@code expectedPrimary} to {@code newPrimary}.
     * 
     * @throws ConflictException if the designated primary is no longer {@code expectedPrimary}
     */
    public void compareAndSetPrimary(String serviceId, String expectedPrimary, String newPrimary) {
        primaryOf(serviceId);
        get(serviceId, newPrimary);
        
        primaries.compute(serviceId, (k, current) -> {
            if (!current.equals(expectedPrimary)) {
                metricsRegistry.recordStateConflict(serviceId, newPrimary);
                throw new ConflictException("primary:" + serviceId, expectedPrimary, current);
            }
            return newPrimary;
        });
        log.info("Primary of {} moved {} -> {}", serviceId, expectedPrimary, newPrimary);
    }
    
    /**
     * Hand the primary designation to the region a completed failover left in charge.
     * Startup only, before any decision loop reads the store.
     */
    public void restorePrimary(String serviceId, String regionId) {
        String configured = primaryOf(serviceId);
        get(serviceId, regionId);
        if (configured.equals(regionId)) {
            return;
        }
        primaries.put(serviceId, regionId);
        regions.computeIfPresent(key(serviceId, regionId),
            (k, r) -> r.withRole(RegionRole.PRIMARY).withVersion(r.version() + 1));
        regions.computeIfPresent(key(serviceId, configured),
            (k, r) -> r.withRole(RegionRole.STANDBY).withVersion(r.version() + 1));
        log.info("Primary of {} restored to {} (configured {})", serviceId, regionId, configured);
    }
    
    public static boolean isTransitionAllowed(RegionState from, RegionState to) {
        return ALLOWED_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }
    
    private static String key(String serviceId, String regionId) {
        return serviceId + "/" + regionId;
    }
}
