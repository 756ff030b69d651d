package com.platform.failover.executor.steps;

import com.platform.failover.connectors.WriteControlApi;
import com.platform.failover.executor.FailoverStep;
import com.platform.failover.executor.StepResult;
import com.platform.failover.model.FailoverEvent;
import com.platform.failover.model.RegionState;
import com.platform.failover.state.RegionStateStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Stops writes on the old primary. An unreachable old primary cannot accept writes, so
 * nothing is called and the step succeeds.
 */
@Order(1)
@Component
public class QuiesceWritesStep implements FailoverStep {
    
    public static final String NAME = "quiesce-writes";
    
    private final WriteControlApi writeControl;
    private final RegionStateStore stateStore;
    
    public QuiesceWritesStep(WriteControlApi writeControl, RegionStateStore stateStore) {
        this.writeControl = writeControl;
        this.stateStore = stateStore;
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public StepResult execute(FailoverEvent event) {
        if (isUnreachable(event)) {
            return StepResult.succeeded("old primary " + event.getFromRegion() + " unreachable, writes not quiesced");
        }
        writeControl.quiesceWrites(event.getServiceId(), event.getFromRegion());
        return StepResult.succeeded("writes quiesced on " + event.getFromRegion());
    }
    
    @Override
    public StepResult compensate(FailoverEvent event) {
        if (isUnreachable(event)) {
            return StepResult.succeeded("old primary " + event.getFromRegion() + " unreachable, nothing to resume");
        }
        writeControl.resumeWrites(event.getServiceId(), event.getFromRegion());
        return StepResult.succeeded("writes resumed on " + event.getFromRegion());
    }
    
    private boolean isUnreachable(FailoverEvent event) {
        return stateStore.get(event.getServiceId(), event.getFromRegion()).state() == RegionState.UNREACHABLE;
    }
}
