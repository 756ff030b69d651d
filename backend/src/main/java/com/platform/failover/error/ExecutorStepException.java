package com.platform.failover.error;

/**
 * A failover step exhausted its retries.
 */
public class ExecutorStepException extends FailoverControllerException {
    
    private final String failoverEventId;
    private final String stepName;
    
    public ExecutorStepException(String failoverEventId, String stepName, String message, Throwable cause) {
        super(ErrorCode.EXECUTOR_STEP_FAILED,
            String.format("Step '%s' of failover %s failed: %s", stepName, failoverEventId, message), cause);
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
