package com.platform.failover.executor.steps;

import com.platform.failover.connectors.TrafficRoutingApi;
import com.platform.failover.executor.FailoverStep;
import com.platform.failover.executor.StepResult;
import com.platform.failover.model.FailoverEvent;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Order(3)
@Component
public class UpdateRoutingStep implements FailoverStep {
    
    public static final String NAME = "update-routing";
    
    private final TrafficRoutingApi routing;
    
    public UpdateRoutingStep(TrafficRoutingApi routing) {
        this.routing = routing;
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public StepResult execute(FailoverEvent event) {
        routing.route(event.getServiceId(), event.getToRegion());
        return StepResult.succeeded("traffic routed to " + event.getToRegion());
    }
    
    @Override
    public StepResult compensate(FailoverEvent event) {
        routing.route(event.getServiceId(), event.getFromRegion());
        return StepResult.succeeded("traffic routed back to " + event.getFromRegion());
    }
}
