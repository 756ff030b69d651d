package com.platform.failover.coordinator;

import com.platform.failover.config.Fleet;
import com.platform.failover.config.FleetProperties;
import com.platform.failover.config.OverrideAuthorizer;
import com.platform.failover.config.SchedulingConfig;
import com.platform.failover.connectors.ReplicationLagProvider;
import com.platform.failover.detector.FailureDetector;
import com.platform.failover.error.ResourceNotFoundException;
import com.platform.failover.executor.FailoverExecutor;
import com.platform.failover.model.FailoverEvent;
import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.notify.Notifier;
import com.platform.failover.observability.MetricsRegistry;
import com.platform.failover.observability.StructuredLogger;
import com.platform.failover.persistence.FailoverEventStore;
import com.platform.failover.probe.HealthProbeRegistry;
import com.platform.failover.probe.ProbeSampleListener;
import com.platform.failover.slo.SloTracker;
import com.platform.failover.state.RegionStateStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Wires one detector, coordinator and decision loop per service, routes probe samples and
 * operator signals to them and drives the periodic decision tick.
 * 
 * Loops are started by startup recovery once the primary designations are restored;
 * signals submitted earlier wait in the queues.
 */
@Slf4j
@Component
public class DecisionLoopManager implements ProbeSampleListener {
    
    private final Map<String, ServiceDecisionLoop> loops = new LinkedHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final long tickIntervalMs;
    private ScheduledFuture<?> ticks;
    
    public DecisionLoopManager(Fleet fleet,
                               FleetProperties properties,
                               SloTracker sloTracker,
                               RegionStateStore stateStore,
                               FailoverEventStore eventStore,
                               FailoverExecutor executor,
                               ReplicationLagProvider lagProvider,
                               HealthProbeRegistry probeRegistry,
                               OverrideAuthorizer authorizer,
                               Notifier notifier,
                               MetricsRegistry metricsRegistry,
                               StructuredLogger structuredLogger,
                               Clock clock,
                               @Qualifier(SchedulingConfig.PROBE_SCHEDULER) ScheduledExecutorService scheduler,
                               @Qualifier(SchedulingConfig.FAILOVER_WORKERS) ExecutorService workers) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.tickIntervalMs = properties.getDecision().getTickInterval().toMillis();
        
        CoordinatorContext context = new CoordinatorContext(
            sloTracker,
            stateStore,
            eventStore,
            executor,
            new TargetSelector(stateStore, lagProvider),
            probeRegistry,
            authorizer,
            notifier,
            metricsRegistry,
            structuredLogger,
            clock,
            workers
        );
        
        for (ServiceDefinition service : fleet.services()) {
            ServiceDecisionLoop loop = new ServiceDecisionLoop(service.serviceId(),
                properties.getDecision().getQueueCapacity(),
                properties.getDecision().getSignalOfferTimeout(),
                metricsRegistry);
            FailureDetector detector = new FailureDetector(service, sloTracker, stateStore, notifier,
                metricsRegistry, structuredLogger);
            loop.bind(new FailoverCoordinator(service, detector, context, loop::submit));
            loops.put(service.serviceId(), loop);
        }
    }
    
    public synchronized void start() {
        if (ticks != null) {
            return;
        }
        for (ServiceDecisionLoop loop : loops.values()) {
            loop.coordinator().reloadPrimary();
            loop.start();
        }
        ticks = scheduler.scheduleAtFixedRate(this::tickAll, tickIntervalMs, tickIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Started {} decision loops, tick every {}ms", loops.size(), tickIntervalMs);
    }
    
    @PreDestroy
    public synchronized void stop() {
        if (ticks != null) {
            ticks.cancel(false);
        }
        loops.values().forEach(ServiceDecisionLoop::stop);
    }
    
    @Override
    public void onSample(ProbeSample sample) {
        ServiceDecisionLoop loop = loops.get(sample.serviceId());
        if (loop != null) {
            loop.submit(new DecisionSignal.Sample(sample));
        }
    }
    
    /**
     * @return false if the signal could not be queued
     */
    public boolean submitOverride(OverrideSignal signal) {
        return loop(signal.serviceId()).submit(signal);
    }
    
    public boolean resume(FailoverEvent event) {
        return loop(event.getServiceId()).submit(new DecisionSignal.Resume(event.getServiceId(), event));
    }
    
    public CoordinatorSnapshot snapshot(String serviceId) {
        return loop(serviceId).coordinator().snapshot();
    }
    
    public Collection<ServiceDecisionLoop> loops() {
        return loops.values();
    }
    
    private void tickAll() {
        for (Map.Entry<String, ServiceDecisionLoop> entry : loops.entrySet()) {
            entry.getValue().submit(new DecisionSignal.Tick(entry.getKey(), clock.instant()));
        }
    }
    
    private ServiceDecisionLoop loop(String serviceId) {
        ServiceDecisionLoop loop = loops.get(serviceId);
        if (loop == null) {
            throw ResourceNotFoundException.service(serviceId);
        }
        return loop;
    }
}
