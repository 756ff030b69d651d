package com.platform.failover.coordinator;

import com.platform.failover.config.OverrideAuthorizer;
import com.platform.failover.executor.FailoverExecutor;
import com.platform.failover.notify.Notifier;
import com.platform.failover.observability.MetricsRegistry;
import com.platform.failover.observability.StructuredLogger;
import com.platform.failover.persistence.FailoverEventStore;
import com.platform.failover.probe.HealthProbeRegistry;
import com.platform.failover.slo.SloTracker;
import com.platform.failover.state.RegionStateStore;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Collaborators shared by every service's coordinator.
 * 
 * @param worker runs execution, verification and rollback off the decision loop
 */
public record CoordinatorContext(
    SloTracker sloTracker,
    RegionStateStore stateStore,
    FailoverEventStore eventStore,
    FailoverExecutor executor,
    TargetSelector targetSelector,
    HealthProbeRegistry probeRegistry,
    OverrideAuthorizer authorizer,
    Notifier notifier,
    MetricsRegistry metricsRegistry,
    StructuredLogger structuredLogger,
    Clock clock,
    Executor worker
) {}
