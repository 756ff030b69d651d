package com.platform.failover.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Structured event emitted to the notification sink for alerting and audit.
 */
public record AvailabilityEvent(
    String eventId,
    EventType eventType,
    String serviceId,
    String regionId,
    Instant timestamp,
    String message,
    Map<String, Object> metadata
) {
    public enum EventType {
        // Region health
        REGION_STATE_CHANGED,
        ERROR_BUDGET_BURNING,
        
        // Coordinator
        COORDINATOR_STATE_CHANGED,
        FAILOVER_EVALUATION_STARTED,
        FAILOVER_EVALUATION_CANCELLED,
        FAILOVER_TARGET_UNQUALIFIED,
        
        // Failover lifecycle
        FAILOVER_STARTED,
        FAILOVER_STEP_COMPLETED,
        FAILOVER_STEP_FAILED,
        FAILOVER_VERIFYING,
        FAILOVER_COMPLETED,
        FAILOVER_ROLLING_BACK,
        FAILOVER_ROLLED_BACK,
        FAILOVER_ABORTED,
        
        // Manual gate
        OVERRIDE_RECEIVED,
        OVERRIDE_REJECTED,
        ABORT_CLEARED
    }
    
    public static AvailabilityEvent create(EventType type, String serviceId, String regionId, String message) {
        return new AvailabilityEvent(
            UUID.randomUUID().toString(),
            type,
            serviceId,
            regionId,
            Instant.now(),
            message,
            Map.of()
        );
    }
    
    public static AvailabilityEvent create(EventType type, String serviceId, String regionId, String message,
                                           Map<String, Object> metadata) {
        return new AvailabilityEvent(
            UUID.randomUUID().toString(),
            type,
            serviceId,
            regionId,
            Instant.now(),
            message,
            metadata
        );
    }
    
    /**
     * Whether this event should page a human.
     */
    public boolean requiresEscalation() {
        return eventType == EventType.FAILOVER_TARGET_UNQUALIFIED
            || eventType == EventType.FAILOVER_ABORTED
            || eventType == EventType.FAILOVER_ROLLING_BACK;
    }
}
