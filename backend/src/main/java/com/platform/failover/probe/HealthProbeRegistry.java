package com.platform.failover.probe;

import com.platform.failover.model.HealthEndpoint;
import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.ProbeType;
import com.platform.failover.model.RegionDefinition;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the probe implementation for an endpoint and records the outcome metrics.
 */
@Slf4j
@Component
public class HealthProbeRegistry {
    
    private final Map<ProbeType, HealthProbe> probes = new EnumMap<>(ProbeType.class);
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    
    public HealthProbeRegistry(List<HealthProbe> probes, MetricsRegistry metricsRegistry, Clock clock) {
        probes.forEach(p -> this.probes.put(p.type(), p));
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }
    
    public ProbeSample probe(ServiceDefinition service, RegionDefinition region) {
        return probe(service.serviceId(), region.regionId(), region.healthEndpoint(),
            service.thresholds().probeTimeout());
    }
    
    /**
     * Run one probe. Unexpected errors from an implementation become a failure sample.
     */
    public ProbeSample probe(String serviceId, String regionId, HealthEndpoint endpoint, Duration timeout) {
        HealthProbe probe = probes.get(endpoint.type());
        ProbeSample sample;
        if (probe == null) {
            sample = ProbeSample.failure(serviceId, regionId, clock.instant(), Duration.ZERO,
                "no probe registered for " + endpoint.type());
        } else {
            try {
                sample = probe.probe(serviceId, regionId, endpoint, timeout);
            } catch (RuntimeException e) {
                log.warn("Probe of {}/{} at {} raised {}", serviceId, regionId, endpoint.describe(), e.toString());
                sample = ProbeSample.failure(serviceId, regionId, clock.instant(), Duration.ZERO, e.getMessage());
            }
        }
        
        metricsRegistry.recordProbe(serviceId, regionId, sample.outcome().name(), sample.latency().toMillis());
        if (!sample.isSuccess()) {
            log.debug("Probe {}/{} {}: {}", serviceId, regionId, sample.outcome(), sample.detail());
        }
        return sample;
    }
}
