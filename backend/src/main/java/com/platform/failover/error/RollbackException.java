package com.platform.failover.error;

/**
 * Compensation of a failover could not be completed. Fatal: the service is left
 * {@code Aborted} until an operator clears it.
 */
public class RollbackException extends FailoverControllerException {
    
    private final String failoverEventId;
    private final String stepName;
    
    public RollbackException(String failoverEventId, String stepName, String message, Throwable cause) {
        super(ErrorCode.ROLLBACK_FAILED,
            String.format("Compensation of step '%s' for failover %s failed: %s", stepName, failoverEventId, message),
            cause);
        this.failoverEventId = failoverEventId;
        this.stepName = stepName;
    }
    
    public String getFailoverEventId() {
        return failoverEventId;
    }
    
    public String getStepName() {
        return stepName;
    }
}
