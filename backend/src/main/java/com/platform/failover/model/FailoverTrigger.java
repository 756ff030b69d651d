package com.platform.failover.model;

public enum FailoverTrigger {
    /**
     * Opened by the coordinator after the primary became unreachable or burned its budget.
     */
    AUTOMATIC,
    /**
     * Forced by an authorized operator override.
     */
    MANUAL
}
