package com.platform.failover.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured logger for controller events.
 * 
 * All logs are JSON-formatted and machine-parsable, one logger per concern:
 * {@code structuredLogger.failover().opened(...)}.
 */
@Component
public class StructuredLogger {
    
    private final String serviceName;
    private final String environment;
    
    public StructuredLogger(
            @Value("${spring.application.name:region-failover-controller}") String serviceName,
            @Value("${failover.tracing.environment:development}") String environment) {
        this.serviceName = serviceName;
        this.environment = environment;
    }
    
    public DetectorLogger detector() {
        return new DetectorLogger(serviceName, environment);
    }
    
    public FailoverLogger failover() {
        return new FailoverLogger(serviceName, environment);
    }
    
    public OverrideLogger override() {
        return new OverrideLogger(serviceName, environment);
    }
    
    public LifecycleLogger lifecycle() {
        return new LifecycleLogger(serviceName, environment);
    }
    
    // ==================== DETECTOR LOGGER ====================
    
    public static class DetectorLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.detector");
        private final String service;
        private final String environment;
        
        DetectorLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void transition(String serviceId, String regionId, String from, String to, String reason) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.REGION_TRANSITION, "INFO")
                .actor("failure-detector")
                .serviceId(serviceId)
                .regionId(regionId)
                .fromState(from)
                .toState(to)
                .message(reason)
                .build();
            log.info(event.toJson());
        }
        
        public void conflictDeferred(String serviceId, String regionId, String detail) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.STATE_CONFLICT, "WARN")
                .actor("failure-detector")
                .serviceId(serviceId)
                .regionId(regionId)
                .errorCode("CP-312")
                .errorMessage(detail)
                .build();
            log.warn(event.toJson());
        }
    }
    
    // ==================== FAILOVER LOGGER ====================
    
    public static class FailoverLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.failover");
        private final String service;
        private final String environment;
        
        FailoverLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void coordinatorTransition(String serviceId, String from, String to, String reason) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.COORDINATOR_TRANSITION, "INFO")
                .actor("failover-coordinator")
                .serviceId(serviceId)
                .fromState(from)
                .toState(to)
                .message(reason)
                .build();
            log.info(event.toJson());
        }
        
        public void opened(String failoverEventId, String serviceId, String fromRegion, String toRegion,
                String actor) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.FAILOVER_OPENED, "WARN")
                .actor(actor)
                .failoverEventId(failoverEventId)
                .serviceId(serviceId)
                .fromState(fromRegion)
                .toState(toRegion)
                .build();
            log.warn(event.toJson());
        }
        
        public void step(String failoverEventId, String serviceId, String stepName, int attempt,
                String outcome, long durationMs, String detail) {
            boolean succeeded = "SUCCEEDED".equals(outcome) || "COMPENSATED".equals(outcome);
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.FAILOVER_STEP, succeeded ? "INFO" : "WARN")
                .actor("failover-executor")
                .failoverEventId(failoverEventId)
                .serviceId(serviceId)
                .action(stepName)
                .success(succeeded)
                .durationMs(durationMs)
                .message(detail)
                .context(Map.of("attempt", attempt, "outcome", outcome))
                .build();
            if (succeeded) {
                log.info(event.toJson());
            } else {
                log.warn(event.toJson());
            }
        }
        
        public void finished(String failoverEventId, String serviceId, String phase, String reason) {
            boolean completed = "COMPLETED".equals(phase);
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.FAILOVER_FINISHED, completed ? "INFO" : "ERROR")
                .actor("failover-coordinator")
                .failoverEventId(failoverEventId)
                .serviceId(serviceId)
                .toState(phase)
                .success(completed)
                .message(reason)
                .build();
            if (completed) {
                log.info(event.toJson());
            } else {
                log.error(event.toJson());
            }
        }
        
        public void resumed(String failoverEventId, String serviceId, String phase) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.FAILOVER_RESUMED, "WARN")
                .actor("startup-recovery")
                .failoverEventId(failoverEventId)
                .serviceId(serviceId)
                .toState(phase)
                .build();
            log.warn(event.toJson());
        }
    }
    
    // ==================== OVERRIDE LOGGER (AUDIT) ====================
    
    public static class OverrideLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.audit");
        private final String service;
        private final String environment;
        
        OverrideLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void accepted(String serviceId, String type, String operator, String reason, String targetRegion) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.OVERRIDE_ACCEPTED, "WARN")
                .actor(operator)
                .serviceId(serviceId)
                .regionId(targetRegion)
                .action(type)
                .success(true)
                .message(reason)
                .build();
            log.warn(event.toJson());
        }
        
        public void rejected(String serviceId, String type, String operator, String why) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.OVERRIDE_REJECTED, "WARN")
                .actor(operator)
                .serviceId(serviceId)
                .action(type)
                .success(false)
                .errorMessage(why)
                .build();
            log.warn(event.toJson());
        }
    }
    
    // ==================== LIFECYCLE LOGGER ====================
    
    public static class LifecycleLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.lifecycle");
        private final String service;
        private final String environment;
        
        LifecycleLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void fleetLoaded(int services, int regions) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.FLEET_LOADED, "INFO")
                .actor("system")
                .context(Map.of("services", services, "regions", regions))
                .build();
            log.info(event.toJson());
        }
        
        public void ready(int liveFailovers) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.APP_READY, "INFO")
                .actor("system")
                .context(Map.of("live_failovers", liveFailovers))
                .build();
            log.info(event.toJson());
        }
    }
}
