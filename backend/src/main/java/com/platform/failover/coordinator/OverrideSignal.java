package com.platform.failover.coordinator;

/**
 * Explicit operator instruction to a service's coordinator. Never inferred.
 */
public record OverrideSignal(
    OverrideType type,
    String serviceId,
    String targetRegion,
    String operator,
    String reason,
    String token
) implements DecisionSignal {
    
    @Override
    public String toString() {
        return String.format("OverrideSignal[%s %s target=%s by %s: %s]", type, serviceId, targetRegion, operator, reason);
    }
}
