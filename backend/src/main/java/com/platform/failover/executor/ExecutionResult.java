package com.platform.failover.executor;

/**
 * Outcome of running the step sequence of one failover.
 */
public record ExecutionResult(Status status, String failedStep, String detail) {
    
    public enum Status {
        COMPLETED,
        FAILED,
        CANCELLED
    }
    
    public static ExecutionResult completed() {
        return new ExecutionResult(Status.COMPLETED, null, null);
    }
    
    public static ExecutionResult failed(String step, String detail) {
        return new ExecutionResult(Status.FAILED, step, detail);
    }
    
    public static ExecutionResult cancelled(String step, String detail) {
        return new ExecutionResult(Status.CANCELLED, step, detail);
    }
    
    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
