package com.platform.failover.model;

public enum StepOutcome {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    CANCELLED,
    COMPENSATED,
    COMPENSATION_FAILED
}
