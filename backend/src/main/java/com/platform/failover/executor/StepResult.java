package com.platform.failover.executor;

import com.platform.failover.model.StepOutcome;

/**
 * What a single step attempt reported. Thrown exceptions count as {@code FAILED}.
 */
public record StepResult(StepOutcome outcome, String detail) {
    
    public static StepResult succeeded(String detail) {
        return new StepResult(StepOutcome.SUCCEEDED, detail);
    }
    
    public static StepResult failed(String detail) {
        return new StepResult(StepOutcome.FAILED, detail);
    }
    
    public boolean isSuccess() {
        return outcome == StepOutcome.SUCCEEDED;
    }
}
