package com.platform.failover.connectors;

/**
 * Response of a database promotion. {@code ALREADY_PRIMARY} counts as success.
 */
public enum PromotionResult {
    PROMOTED,
    ALREADY_PRIMARY,
    FAILED;
    
    public boolean isSuccess() {
        return this != FAILED;
    }
}
