package com.platform.failover.probe;

import com.platform.failover.config.Fleet;
import com.platform.failover.config.SchedulingConfig;
import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.RegionDefinition;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.observability.MetricsRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one fixed-rate probe task per (service, region) pair.
 * 
 * Ticks only dispatch; the probe itself runs on the pool so that a slow probe cannot
 * delay other pairs. A tick that finds the previous probe of its pair still in flight
 * is skipped.
 */
@Slf4j
@Component
public class ProbeScheduler {
    
    private final Fleet fleet;
    private final HealthProbeRegistry probeRegistry;
    private final ProbeSampleListener listener;
    private final ScheduledExecutorService scheduler;
    private final MetricsRegistry metricsRegistry;
    
    private final List<ProbeTask> tasks = new ArrayList<>();
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();
    
    public ProbeScheduler(Fleet fleet,
                          HealthProbeRegistry probeRegistry,
                          ProbeSampleListener listener,
                          @Qualifier(SchedulingConfig.PROBE_SCHEDULER) ScheduledExecutorService scheduler,
                          MetricsRegistry metricsRegistry) {
        this.fleet = fleet;
        this.probeRegistry = probeRegistry;
        this.listener = listener;
        this.scheduler = scheduler;
        this.metricsRegistry = metricsRegistry;
        
        for (ServiceDefinition service : fleet.services()) {
            for (RegionDefinition region : service.regions()) {
                tasks.add(new ProbeTask(service, region));
            }
        }
    }
    
    @Order(10)
    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!scheduled.isEmpty()) {
            return;
        }
        for (ProbeTask task : tasks) {
            long intervalMs = task.service.thresholds().probeInterval().toMillis();
            scheduled.add(scheduler.scheduleAtFixedRate(task::tick, 0, intervalMs, TimeUnit.MILLISECONDS));
        }
        log.info("Scheduled {} probe tasks across {} services", tasks.size(), fleet.services().size());
    }
    
    @PreDestroy
    public synchronized void stop() {
        scheduled.forEach(f -> f.cancel(false));
        scheduled.clear();
        log.info("Probe tasks stopped");
    }
    
    List<ProbeTask> tasks() {
        return tasks;
    }
    
    /**
     * Probe loop state for one pair.
     */
    final class ProbeTask {
        
        private final ServiceDefinition service;
        private final RegionDefinition region;
        private final AtomicBoolean inFlight = new AtomicBoolean(false);
        
        ProbeTask(ServiceDefinition service, RegionDefinition region) {
            this.service = service;
            this.region = region;
        }
        
        void tick() {
            if (!inFlight.compareAndSet(false, true)) {
                metricsRegistry.recordSuppressedProbe(service.serviceId(), region.regionId());
                log.debug("Probe {}/{} still in flight, skipping tick", service.serviceId(), region.regionId());
                return;
            }
            try {
                scheduler.execute(this::run);
            } catch (RuntimeException e) {
                inFlight.set(false);
                log.warn("Could not dispatch probe {}/{}: {}", service.serviceId(), region.regionId(), e.getMessage());
            }
        }
        
        void run() {
            try {
                ProbeSample sample = probeRegistry.probe(service, region);
                listener.onSample(sample);
            } catch (RuntimeException e) {
                log.error("Probe task {}/{} failed: {}", service.serviceId(), region.regionId(), e.getMessage(), e);
            } finally {
                inFlight.set(false);
            }
        }
        
        boolean isInFlight() {
            return inFlight.get();
        }
        
        String pair() {
            return service.serviceId() + "/" + region.regionId();
        }
    }
}
