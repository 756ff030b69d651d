package com.platform.failover.detector;

import java.time.Instant;

/**
 * An accepted change of detector phase for one region.
 */
public record DetectorTransition(
    String serviceId,
    String regionId,
    DetectorPhase from,
    DetectorPhase to,
    Instant at,
    String reason
) {
    
    public boolean isDegradation() {
        return switch (to) {
            case SUSPECTED_DEGRADED -> from == DetectorPhase.HEALTHY;
            case DEGRADED -> from != DetectorPhase.UNREACHABLE;
            case UNREACHABLE -> true;
            case HEALTHY, RECOVERING -> false;
        };
    }
}
