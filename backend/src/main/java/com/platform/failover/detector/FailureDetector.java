package com.platform.failover.detector;

import com.platform.failover.error.ConfigurationException;
import com.platform.failover.error.ConflictException;
import com.platform.failover.model.AvailabilityEvent;
import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.Region;
import com.platform.failover.model.RegionDefinition;
import com.platform.failover.model.RegionState;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.notify.Notifications;
import com.platform.failover.notify.Notifier;
import com.platform.failover.observability.MetricsRegistry;
import com.platform.failover.observability.StructuredLogger;
import com.platform.failover.slo.SloTracker;
import com.platform.failover.state.RegionStateStore;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Failure detector for one service: folds probe samples and short-window burn rate into
 * per-region hysteresis trackers and writes the resulting state to the region store.
 * 
 * One instance per service, driven only by that service's decision loop. It never acts on
 * the executor; accepted transitions are returned to the caller for the coordinator.
 */
@Slf4j
public class FailureDetector {
    
    private final ServiceDefinition service;
    private final SloTracker sloTracker;
    private final RegionStateStore stateStore;
    private final Notifier notifier;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Map<String, RegionHealthTracker> trackers = new LinkedHashMap<>();
    
    public FailureDetector(ServiceDefinition service,
                           SloTracker sloTracker,
                           RegionStateStore stateStore,
                           Notifier notifier,
                           MetricsRegistry metricsRegistry,
                           StructuredLogger structuredLogger) {
        if (service.thresholds().successesToRecover() <= service.thresholds().failuresToDegrade()) {
            throw new ConfigurationException(String.format(
                "%s: successes-to-recover (%d) must be greater than failures-to-degrade (%d)",
                service.serviceId(), service.thresholds().successesToRecover(),
                service.thresholds().failuresToDegrade()));
        }
        this.service = service;
        this.sloTracker = sloTracker;
        this.stateStore = stateStore;
        this.notifier = notifier;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        
        for (RegionDefinition region : service.regions()) {
            trackers.put(region.regionId(),
                new RegionHealthTracker(service.serviceId(), region.regionId(), service.thresholds(), service.rto()));
        }
    }
    
    /**
     * Process one sample for a region of this service.
     * 
     * @return the accepted phase transition, if the sample caused one
     */
    public Optional<DetectorTransition> onSample(ProbeSample sample) {
        RegionHealthTracker tracker = tracker(sample.regionId());
        
        sloTracker.record(sample);
        double shortBurn = sloTracker.burnRate(service.serviceId(), sample.regionId(), SloTracker.SHORT_WINDOW);
        
        Optional<DetectorTransition> transition = tracker.observe(sample, shortBurn);
        stateStore.recordProbe(service.serviceId(), sample.regionId(), sample.timestamp(),
            tracker.consecutiveFailures());
        
        transition.ifPresent(this::announce);
        reconcile(tracker, true);
        return transition;
    }
    
    /**
     * Re-apply the tracked phase of every region whose stored state drifted, e.g. after
     * a deferred conflict or once the executor releases a region.
     */
    public void reconcileAll() {
        trackers.values().forEach(t -> reconcile(t, true));
    }
    
    private void reconcile(RegionHealthTracker tracker, boolean retry) {
        String regionId = tracker.regionId();
        Region current = stateStore.get(service.serviceId(), regionId);
        RegionState desired = tracker.phase().toRegionState();
        
        if (current.state().isOwnedByExecutor() || current.state() == desired) {
            return;
        }
        
        try {
            stateStore.compareAndSetState(service.serviceId(), regionId, current.state(), desired);
        } catch (ConflictException e) {
            if (retry) {
                reconcile(tracker, false);
            } else {
                log.info("State of {}/{} changed concurrently, deferring to next tick", service.serviceId(), regionId);
                structuredLogger.detector().conflictDeferred(service.serviceId(), regionId, e.getMessage());
            }
        }
    }
    
    private void announce(DetectorTransition t) {
        if (t.isDegradation()) {
            log.warn("Region {}/{} {} -> {} ({})", t.serviceId(), t.regionId(), t.from(), t.to(), t.reason());
        } else {
            log.info("Region {}/{} {} -> {} ({})", t.serviceId(), t.regionId(), t.from(), t.to(), t.reason());
        }
        metricsRegistry.recordDetectorTransition(t.serviceId(), t.regionId(), t.from(), t.to());
        structuredLogger.detector().transition(t.serviceId(), t.regionId(), t.from().name(), t.to().name(), t.reason());
        
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("from", t.from().name());
        metadata.put("to", t.to().name());
        metadata.put("regionState", t.to().toRegionState().name());
        metadata.put("reason", t.reason());
        metadata.put("degrading", t.isDegradation());
        Notifications.publishQuietly(notifier, AvailabilityEvent.create(
            AvailabilityEvent.EventType.REGION_STATE_CHANGED,
            t.serviceId(),
            t.regionId(),
            String.format("Region %s of %s is now %s", t.regionId(), t.serviceId(), t.to()),
            metadata
        ));
        
        if (t.to() == DetectorPhase.SUSPECTED_DEGRADED && t.reason().startsWith("short-window burn")) {
            Notifications.publishQuietly(notifier, AvailabilityEvent.create(
                AvailabilityEvent.EventType.ERROR_BUDGET_BURNING,
                t.serviceId(),
                t.regionId(),
                t.reason()
            ));
        }
    }
    
    public DetectorPhase phaseOf(String regionId) {
        return tracker(regionId).phase();
    }
    
    public String serviceId() {
        return service.serviceId();
    }
    
    private RegionHealthTracker tracker(String regionId) {
        RegionHealthTracker tracker = trackers.get(regionId);
        if (tracker == null) {
            throw new IllegalArgumentException("Unknown region " + regionId + " for service " + service.serviceId());
        }
        return tracker;
    }
}
