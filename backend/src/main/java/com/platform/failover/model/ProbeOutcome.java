package com.platform.failover.model;

public enum ProbeOutcome {
    SUCCESS,
    FAILURE,
    TIMEOUT
}
