package com.platform.failover.observability;

/**
 * Event types for structured logs.
 */
public enum LogEventType {
    // Application lifecycle
    APP_READY,
    FLEET_LOADED,
    
    // Failure detector
    REGION_TRANSITION,
    STATE_CONFLICT,
    
    // Coordinator / failover
    COORDINATOR_TRANSITION,
    FAILOVER_OPENED,
    FAILOVER_STEP,
    FAILOVER_FINISHED,
    FAILOVER_RESUMED,
    
    // Manual gate (audit)
    OVERRIDE_ACCEPTED,
    OVERRIDE_REJECTED
}
