package com.platform.failover.model;

/**
 * Phase of a FailoverEvent. COMPLETED, ROLLED_BACK and ABORTED are terminal.
 */
public enum FailoverPhase {
    EXECUTING,
    VERIFYING,
    ROLLING_BACK,
    COMPLETED,
    ROLLED_BACK,
    ABORTED;
    
    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK || this == ABORTED;
    }
}
