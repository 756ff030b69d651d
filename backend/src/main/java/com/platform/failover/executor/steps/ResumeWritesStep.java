package com.platform.failover.executor.steps;

import com.platform.failover.connectors.WriteControlApi;
import com.platform.failover.executor.FailoverStep;
import com.platform.failover.executor.StepResult;
import com.platform.failover.model.FailoverEvent;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Opens writes on the new primary. Compensation closes them again.
 */
@Order(4)
@Component
public class ResumeWritesStep implements FailoverStep {
    
    public static final String NAME = "resume-writes";
    
    private final WriteControlApi writeControl;
    
    public ResumeWritesStep(WriteControlApi writeControl) {
        this.writeControl = writeControl;
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public StepResult execute(FailoverEvent event) {
        writeControl.resumeWrites(event.getServiceId(), event.getToRegion());
        return StepResult.succeeded("writes resumed on " + event.getToRegion());
    }
    
    @Override
    public StepResult compensate(FailoverEvent event) {
        writeControl.quiesceWrites(event.getServiceId(), event.getToRegion());
        return StepResult.succeeded("writes quiesced on " + event.getToRegion());
    }
}
