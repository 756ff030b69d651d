package com.platform.failover.recovery;

import com.platform.failover.config.Fleet;
import com.platform.failover.coordinator.DecisionLoopManager;
import com.platform.failover.model.FailoverEvent;
import com.platform.failover.model.FailoverPhase;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.observability.MetricsRegistry;
import com.platform.failover.observability.StructuredLogger;
import com.platform.failover.persistence.FailoverEventStore;
import com.platform.failover.state.RegionStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Restores what the controller knew at shutdown before any decision is made.
 * 
 * Recovery logic:
 * 1. Give each service the primary its latest completed failover left in charge
 * 2. Start the decision loops
 * 3. Find every event that is not terminal
 * 4. Skip events of services no longer in the fleet (logged, left untouched)
 * 5. Queue a resume signal; the coordinator continues from the recorded phase, and the
 *    executor from the first step that has not succeeded
 */
@Slf4j
@Component
public class StartupRecoveryService {
    
    private final FailoverEventStore eventStore;
    private final RegionStateStore stateStore;
    private final DecisionLoopManager loopManager;
    private final Fleet fleet;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    
    public StartupRecoveryService(FailoverEventStore eventStore,
                                  RegionStateStore stateStore,
                                  DecisionLoopManager loopManager,
                                  Fleet fleet,
                                  MetricsRegistry metricsRegistry,
                                  StructuredLogger structuredLogger) {
        this.eventStore = eventStore;
        this.stateStore = stateStore;
        this.loopManager = loopManager;
        this.fleet = fleet;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.HIGHEST_PRECEDENCE + 100)
    public void onApplicationReady() {
        log.info("=== Starting failover recovery ===");
        int restored = restorePrimaries();
        loopManager.start();
        int resumed = recoverLiveFailovers();
        structuredLogger.lifecycle().ready(resumed);
        log.info("=== Failover recovery complete: {} primaries restored, {} resumed ===", restored, resumed);
    }
    
    int restorePrimaries() {
        int restored = 0;
        for (ServiceDefinition service : fleet.services()) {
            Optional<FailoverEvent> completed;
            try {
                completed = eventStore.findByService(service.serviceId()).stream()
                    .filter(e -> e.getPhase() == FailoverPhase.COMPLETED)
                    .findFirst();
            } catch (RuntimeException e) {
                log.error("Could not load failover history of {}, keeping configured primary: {}",
                    service.serviceId(), e.getMessage(), e);
                metricsRegistry.incrementCounter("failover.recovery.failed");
                continue;
            }
            if (completed.isEmpty()) {
                continue;
            }
            
            String regionId = completed.get().getToRegion();
            if (service.region(regionId).isEmpty()) {
                log.warn("Failover {} of {} promoted {}, which is no longer configured; keeping {}",
                    completed.get().getId(), service.serviceId(), regionId, stateStore.primaryOf(service.serviceId()));
                continue;
            }
            if (regionId.equals(stateStore.primaryOf(service.serviceId()))) {
                continue;
            }
            stateStore.restorePrimary(service.serviceId(), regionId);
            metricsRegistry.incrementCounter("failover.recovery.primary_restored", "service", service.serviceId());
            restored++;
        }
        return restored;
    }
    
    int recoverLiveFailovers() {
        List<FailoverEvent> live;
        try {
            live = eventStore.findAllLive();
        } catch (RuntimeException e) {
            log.error("Could not load live failovers, recovery skipped: {}", e.getMessage(), e);
            metricsRegistry.incrementCounter("failover.recovery.failed");
            return 0;
        }
        
        int resumed = 0;
        for (FailoverEvent event : live) {
            if (!fleet.contains(event.getServiceId())) {
                log.warn("Live failover {} belongs to unknown service {}, leaving it untouched",
                    event.getId(), event.getServiceId());
                continue;
            }
            log.info("Resuming failover {} of {} ({} -> {}) in phase {} with {} recorded attempts",
                event.getId(), event.getServiceId(), event.getFromRegion(), event.getToRegion(),
                event.getPhase(), event.getHistory().size());
            if (loopManager.resume(event)) {
                resumed++;
                metricsRegistry.incrementCounter("failover.recovery.resumed");
            } else {
                log.error("Could not queue resume of failover {}", event.getId());
                metricsRegistry.incrementCounter("failover.recovery.failed");
            }
        }
        return resumed;
    }
}
