package com.platform.failover.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Central registry for all controller metrics.
 * Provides methods for recording probe, detector, coordinator and executor metrics.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicLong> gaugeBits;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.gaugeBits = new ConcurrentHashMap<>();
        
        log.info("Metrics registry initialized");
    }
    
    /**
     * Record one probe sample.
     */
    public void recordProbe(String serviceId, String regionId, String outcome, long latencyMs) {
        incrementCounter("failover.probe.samples",
            "service", serviceId, "region", regionId, "outcome", outcome);
        recordLatency("probe", serviceId + "." + regionId, latencyMs);
    }
    
    /**
     * Record a scheduled probe tick skipped because the previous probe is still in flight.
     */
    public void recordSuppressedProbe(String serviceId, String regionId) {
        incrementCounter("failover.probe.suppressed", "service", serviceId, "region", regionId);
    }
    
    /**
     * Record a decision signal that could not be queued.
     */
    public void recordDroppedSignal(String serviceId, String signalType) {
        incrementCounter("failover.decision.dropped", "service", serviceId, "signal", signalType);
    }
    
    public void recordDetectorTransition(String serviceId, String regionId, Object from, Object to) {
        incrementCounter("failover.detector.transition",
            "service", serviceId,
            "region", regionId,
            "from", String.valueOf(from),
            "to", String.valueOf(to));
        log.debug("Recorded detector transition for {}/{}: {} -> {}", serviceId, regionId, from, to);
    }
    
    public void recordCoordinatorTransition(String serviceId, Object from, Object to) {
        incrementCounter("failover.coordinator.transition",
            "service", serviceId,
            "from", String.valueOf(from),
            "to", String.valueOf(to));
    }
    
    public void recordStepOutcome(String serviceId, String stepName, String outcome) {
        incrementCounter("failover.executor.step",
            "service", serviceId, "step", stepName, "outcome", outcome);
    }
    
    public void recordStateConflict(String serviceId, String regionId) {
        incrementCounter("failover.state.conflict", "service", serviceId, "region", regionId);
    }
    
    /**
     * Publish the latest burn rate of a service over a window.
     */
    public void updateBurnRate(String serviceId, String window, double burnRate) {
        setGauge("failover.slo.burn_rate", burnRate, "service", serviceId, "window", window);
    }
    
    public void updateCompliance(String serviceId, String window, double compliance) {
        setGauge("failover.slo.compliance", compliance, "service", serviceId, "window", window);
    }
    
    /**
     * Record latency for an operation.
     */
    public void recordLatency(String component, String operation, long latencyMs) {
        String timerKey = component + "." + operation;
        Timer timer = timers.computeIfAbsent(timerKey, k -> 
            Timer.builder("failover.operation.latency")
                .tag("component", component)
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        
        timer.record(Duration.ofMillis(latencyMs));
    }
    
    /**
     * Increment a counter.
     */
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, k -> 
            Counter.builder(name)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Current value of a gauge set through this registry, or NaN if never set.
     */
    public double getGauge(String name, String... tags) {
        AtomicLong bits = gaugeBits.get(name + String.join(".", tags));
        return bits != null ? Double.longBitsToDouble(bits.get()) : Double.NaN;
    }
    
    private void setGauge(String name, double value, String... tags) {
        String key = name + String.join(".", tags);
        AtomicLong bits = gaugeBits.computeIfAbsent(key, k -> {
            AtomicLong holder = new AtomicLong(Double.doubleToLongBits(0.0));
            Gauge.builder(name, holder, h -> Double.longBitsToDouble(h.get()))
                .tags(tags)
                .register(meterRegistry);
            return holder;
        });
        bits.set(Double.doubleToLongBits(value));
    }
}
