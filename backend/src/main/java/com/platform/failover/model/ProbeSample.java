package com.platform.failover.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one health probe invocation against one (service, region) pair.
 */
public record ProbeSample(
    String serviceId,
    String regionId,
    Instant timestamp,
    ProbeOutcome outcome,
    Duration latency,
    String detail
) {
    
    public static ProbeSample success(String serviceId, String regionId, Instant at, Duration latency) {
        return new ProbeSample(serviceId, regionId, at, ProbeOutcome.SUCCESS, latency, null);
    }
    
    public static ProbeSample failure(String serviceId, String regionId, Instant at, Duration latency, String detail) {
        return new ProbeSample(serviceId, regionId, at, ProbeOutcome.FAILURE, latency, detail);
    }
    
    public static ProbeSample timeout(String serviceId, String regionId, Instant at, Duration timeout) {
        return new ProbeSample(serviceId, regionId, at, ProbeOutcome.TIMEOUT, timeout,
            "no response within " + timeout.toMillis() + "ms");
    }
    
    public boolean isSuccess() {
        return outcome == ProbeOutcome.SUCCESS;
    }
}
