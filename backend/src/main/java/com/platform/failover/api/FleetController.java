package com.platform.failover.api;

import com.platform.failover.api.ApiModels.ServiceStatus;
import com.platform.failover.api.ApiModels.SloStatus;
import com.platform.failover.api.ApiModels.WindowStatus;
import com.platform.failover.config.Fleet;
import com.platform.failover.coordinator.DecisionLoopManager;
import com.platform.failover.model.FailoverEvent;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.persistence.FailoverEventStore;
import com.platform.failover.slo.SloTracker;
import com.platform.failover.state.RegionStateStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only operator API: fleet state, SLO status and failover history.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class FleetController {
    
    private final Fleet fleet;
    private final RegionStateStore stateStore;
    private final SloTracker sloTracker;
    private final DecisionLoopManager loopManager;
    private final FailoverEventStore eventStore;
    
    @GetMapping("/fleet")
    public List<ServiceStatus> getFleet() {
        return fleet.services().stream()
            .map(s -> status(s.serviceId()))
            .toList();
    }
    
    @GetMapping("/services/{serviceId}")
    public ServiceStatus getService(@PathVariable String serviceId) {
        fleet.service(serviceId);
        return status(serviceId);
    }
    
    /**
     * SLO status of the current primary, or of {@code region} when given.
     */
    @GetMapping("/services/{serviceId}/slo")
    public SloStatus getSlo(@PathVariable String serviceId,
                            @RequestParam(required = false) String region) {
        ServiceDefinition service = fleet.service(serviceId);
        String regionId = region != null ? stateStore.get(serviceId, region).regionId() : stateStore.primaryOf(serviceId);
        
        List<WindowStatus> windows = sloTracker.windowNames().stream()
            .map(w -> new WindowStatus(
                w,
                sloTracker.compliance(serviceId, regionId, w),
                sloTracker.burnRate(serviceId, regionId, w),
                sloTracker.errorBudget(serviceId, regionId, w)))
            .toList();
        return new SloStatus(serviceId, regionId, service.slo().ratio(), windows);
    }
    
    @GetMapping("/services/{serviceId}/failovers")
    public List<FailoverEvent> getFailovers(@PathVariable String serviceId) {
        fleet.service(serviceId);
        return eventStore.findByService(serviceId);
    }
    
    private ServiceStatus status(String serviceId) {
        return new ServiceStatus(
            serviceId,
            stateStore.primaryOf(serviceId),
            loopManager.snapshot(serviceId),
            stateStore.regionsOf(serviceId)
        );
    }
}
