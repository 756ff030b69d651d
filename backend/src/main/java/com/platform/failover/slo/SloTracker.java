package com.platform.failover.slo;

import com.platform.failover.config.Fleet;
import com.platform.failover.error.ResourceNotFoundException;
import com.platform.failover.error.ValidationException;
import com.platform.failover.model.ErrorBudget;
import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.RegionDefinition;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.model.SloTarget;
import com.platform.failover.observability.MetricsRegistry;
import com.platform.failover.state.RegionStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling SLO compliance and error-budget burn rate per (service, region), over several
 * windows at once.
 * 
 * Every query evicts expired samples first, so results are always recomputed from the
 * live window. Service-level queries answer for the service's current primary region.
 */
@Slf4j
@Component
public class SloTracker {
    
    public static final String SHORT_WINDOW = "short";
    public static final String LONG_WINDOW = "long";
    
    private final Fleet fleet;
    private final RegionStateStore stateStore;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    
    private final Map<String, Map<String, SampleWindow>> windows = new ConcurrentHashMap<>();
    
    public SloTracker(Fleet fleet, RegionStateStore stateStore, MetricsRegistry metricsRegistry, Clock clock) {
        this.fleet = fleet;
        this.stateStore = stateStore;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        
        for (ServiceDefinition service : fleet.services()) {
            for (RegionDefinition region : service.regions()) {
                Map<String, SampleWindow> byName = new LinkedHashMap<>();
                byName.put(SHORT_WINDOW, new SampleWindow(SHORT_WINDOW, service.thresholds().shortWindow()));
                byName.put(LONG_WINDOW, new SampleWindow(LONG_WINDOW, service.thresholds().longWindow()));
                windows.put(key(service.serviceId(), region.regionId()), byName);
            }
        }
    }
    
    /**
     * Append a sample to every window of its (service, region) pair.
     */
    public void record(ProbeSample sample) {
        SloTarget slo = fleet.service(sample.serviceId()).slo();
        boolean good = slo.isGoodEvent(sample);
        Map<String, SampleWindow> pair = windowsOf(sample.serviceId(), sample.regionId());
        Instant now = clock.instant();
        
        synchronized (pair) {
            for (SampleWindow window : pair.values()) {
                window.append(sample.timestamp(), good, now);
            }
        }
        
        if (sample.regionId().equals(stateStore.primaryOf(sample.serviceId()))) {
            publishGauges(sample.serviceId(), sample.regionId(), slo);
        }
    }
    
    public double compliance(String serviceId, String window) {
        return compliance(serviceId, stateStore.primaryOf(serviceId), window);
    }
    
    public double compliance(String serviceId, String regionId, String window) {
        Map<String, SampleWindow> pair = windowsOf(serviceId, regionId);
        synchronized (pair) {
            SampleWindow w = windowOf(pair, window);
            w.evict(clock.instant());
            return w.compliance();
        }
    }
    
    public double burnRate(String serviceId, String window) {
        return burnRate(serviceId, stateStore.primaryOf(serviceId), window);
    }
    
    public double burnRate(String serviceId, String regionId, String window) {
        double target = fleet.service(serviceId).slo().ratio();
        return burnRate(compliance(serviceId, regionId, window), target);
    }
    
    public ErrorBudget errorBudget(String serviceId, String window) {
        return errorBudget(serviceId, stateStore.primaryOf(serviceId), window);
    }
    
    public ErrorBudget errorBudget(String serviceId, String regionId, String window) {
        SloTarget slo = fleet.service(serviceId).slo();
        Map<String, SampleWindow> pair = windowsOf(serviceId, regionId);
        Instant now = clock.instant();
        
        synchronized (pair) {
            SampleWindow w = windowOf(pair, window);
            w.evict(now);
            return new ErrorBudget(
                serviceId,
                w.name(),
                now.minus(w.length()),
                now,
                w.total(),
                w.total() * slo.allowedErrorRatio(),
                w.bad(),
                burnRate(w.compliance(), slo.ratio())
            );
        }
    }
    
    public List<String> windowNames() {
        return List.of(SHORT_WINDOW, LONG_WINDOW);
    }
    
    /**
     * Ratio of actual to sustainable error consumption: {@code (1 - compliance) / (1 - target)},
     * and 0 whenever compliance meets the target.
     */
    public static double burnRate(double compliance, double target) {
        if (compliance >= target) {
            return 0.0;
        }
        return (1.0 - compliance) / (1.0 - target);
    }
    
    private void publishGauges(String serviceId, String regionId, SloTarget slo) {
        for (String window : windowNames()) {
            double c = compliance(serviceId, regionId, window);
            metricsRegistry.updateCompliance(serviceId, window, c);
            metricsRegistry.updateBurnRate(serviceId, window, burnRate(c, slo.ratio()));
        }
    }
    
    private Map<String, SampleWindow> windowsOf(String serviceId, String regionId) {
        Map<String, SampleWindow> pair = windows.get(key(serviceId, regionId));
        if (pair == null) {
            throw ResourceNotFoundException.region(serviceId, regionId);
        }
        return pair;
    }
    
    private static SampleWindow windowOf(Map<String, SampleWindow> pair, String window) {
        SampleWindow w = pair.get(window);
        if (w == null) {
            throw new ValidationException("window", "unknown window '" + window + "'");
        }
        return w;
    }
    
    private static String key(String serviceId, String regionId) {
        return serviceId + "/" + regionId;
    }
}
