package com.platform.failover.coordinator;

public enum OverrideType {
    /** Block automatic failover, or stop the one in flight. */
    ABORT,
    /** Start a failover regardless of trigger and RPO criteria. */
    FORCE_FAILOVER,
    /** Leave {@code ABORTED} and resume automatic control. */
    CLEAR_ABORT
}
