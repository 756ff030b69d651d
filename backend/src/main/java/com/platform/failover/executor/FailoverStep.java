package com.platform.failover.executor;

import com.platform.failover.model.FailoverEvent;

/**
 * One named, idempotent action of a failover with its compensating action.
 * 
 * Both methods may be invoked more than once for the same event (retries, resumption
 * after a crash) and must converge to the same end state.
 */
public interface FailoverStep {
    
    String name();
    
    StepResult execute(FailoverEvent event);
    
    StepResult compensate(FailoverEvent event);
}
