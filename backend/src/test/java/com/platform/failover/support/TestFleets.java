package com.platform.failover.support;

import com.platform.failover.config.Fleet;
import com.platform.failover.model.FailoverThresholds;
import com.platform.failover.model.HealthEndpoint;
import com.platform.failover.model.RegionDefinition;
import com.platform.failover.model.RegionRole;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.model.SloTarget;

import java.time.Duration;
import java.util.List;

/**
 * Fleet fixtures shared by unit tests.
 */
public final class TestFleets {
    
    public static final String CHECKOUT = "checkout";
    public static final String US_EAST = "us-east";
    public static final String US_WEST = "us-west";
    public static final String EU_WEST = "eu-west";
    
    private TestFleets() {
    }
    
    /**
     * Fast thresholds: N=3 failures within 60s, M=5 recoveries, millisecond backoff and verification.
     */
    public static FailoverThresholds fastThresholds() {
        return new FailoverThresholds(
            Duration.ofSeconds(10),
            Duration.ofSeconds(2),
            3,
            Duration.ofSeconds(60),
            5,
            1.0,
            10.0,
            Duration.ofMinutes(5),
            Duration.ofHours(1),
            3,
            Duration.ofMillis(5),
            2.0,
            Duration.ofMillis(20),
            Duration.ofSeconds(2),
            3,
            Duration.ofMillis(1)
        );
    }
    
    /**
     * Fast thresholds with a different step timeout.
     */
    public static FailoverThresholds withStepTimeout(Duration stepTimeout) {
        FailoverThresholds t = fastThresholds();
        return new FailoverThresholds(t.probeInterval(), t.probeTimeout(), t.failuresToDegrade(),
            t.failureInterval(), t.successesToRecover(), t.suspectBurnRate(), t.hardBurnRate(),
            t.shortWindow(), t.longWindow(), t.maxStepAttempts(), t.initialBackoff(), t.backoffMultiplier(),
            t.maxBackoff(), stepTimeout, t.verificationProbes(), t.verificationInterval());
    }
    
    public static ServiceDefinition checkout() {
        return checkout(fastThresholds());
    }
    
    /**
     * checkout on us-east (primary) and us-west (standby), SLO 99.9%, RTO 5m, RPO 5m.
     */
    public static ServiceDefinition checkout(FailoverThresholds thresholds) {
        return new ServiceDefinition(
            CHECKOUT,
            List.of(
                new RegionDefinition(US_EAST, RegionRole.PRIMARY, HealthEndpoint.http("http://us-east/healthz")),
                new RegionDefinition(US_WEST, RegionRole.STANDBY, HealthEndpoint.http("http://us-west/healthz"))
            ),
            new SloTarget(0.999, Duration.ofMillis(500)),
            Duration.ofMinutes(5),
            Duration.ofMinutes(5),
            thresholds
        );
    }
    
    /**
     * checkout with a third, cold region.
     */
    public static ServiceDefinition checkoutWithColdRegion() {
        return new ServiceDefinition(
            CHECKOUT,
            List.of(
                new RegionDefinition(US_EAST, RegionRole.PRIMARY, HealthEndpoint.http("http://us-east/healthz")),
                new RegionDefinition(EU_WEST, RegionRole.COLD, HealthEndpoint.http("http://eu-west/healthz")),
                new RegionDefinition(US_WEST, RegionRole.STANDBY, HealthEndpoint.http("http://us-west/healthz"))
            ),
            new SloTarget(0.999, Duration.ofMillis(500)),
            Duration.ofMinutes(5),
            Duration.ofMinutes(5),
            fastThresholds()
        );
    }
    
    public static Fleet fleetOf(ServiceDefinition... services) {
        return new Fleet(List.of(services));
    }
}
