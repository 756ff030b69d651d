package com.platform.failover.probe;

import com.platform.failover.model.HealthEndpoint;
import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.ProbeType;

import java.time.Duration;

/**
 * One kind of health check against a region's endpoint.
 * 
 * Implementations return exactly one sample per call and never block past {@code timeout};
 * a missed deadline is reported as a {@code TIMEOUT} sample, never thrown.
 */
public interface HealthProbe {
    
    ProbeType type();
    
    ProbeSample probe(String serviceId, String regionId, HealthEndpoint endpoint, Duration timeout);
}
