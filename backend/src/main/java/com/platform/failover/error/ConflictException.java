package com.platform.failover.error;

/**
 * Optimistic-concurrency collision on the region state store.
 * Callers re-read and retry once, then defer to the next tick.
 */
public class ConflictException extends FailoverControllerException {
    
    private final String resourceKey;
    private final Object expected;
    private final Object actual;
    
    public ConflictException(String resourceKey, Object expected, Object actual) {
        super(ErrorCode.OPTIMISTIC_LOCK_FAILURE,
            String.format("Conflict on %s: expected %s but found %s", resourceKey, expected, actual));
        this.resourceKey = resourceKey;
        this.expected = expected;
        this.actual = actual;
    }
    
    public String getResourceKey() {
        return resourceKey;
    }
    
    public Object getExpected() {
        return expected;
    }
    
    public Object getActual() {
        return actual;
    }
}
