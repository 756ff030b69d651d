package com.platform.failover.executor;

import com.platform.failover.config.Fleet;
import com.platform.failover.config.SchedulingConfig;
import com.platform.failover.error.RollbackException;
import com.platform.failover.model.AvailabilityEvent;
import com.platform.failover.model.FailoverEvent;
import com.platform.failover.model.StepOutcome;
import com.platform.failover.model.StepRecord;
import com.platform.failover.notify.Notifications;
import com.platform.failover.notify.Notifier;
import com.platform.failover.observability.LoggingConfig;
import com.platform.failover.observability.MetricsRegistry;
import com.platform.failover.observability.StructuredLogger;
import com.platform.failover.persistence.FailoverEventStore;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs the ordered failover steps of an event with per-step timeout, bounded retries and
 * compensation.
 * 
 * Every attempt is appended to the event history and persisted before the next action.
 * Re-running an event resumes at the first step whose latest outcome is not
 * {@code SUCCEEDED}; completed steps are never repeated.
 */
@Slf4j
@Component
public class FailoverExecutor {
    
    private static final AttributeKey<String> SERVICE_ID = AttributeKey.stringKey("failover.service_id");
    private static final AttributeKey<String> EVENT_ID = AttributeKey.stringKey("failover.event_id");
    private static final AttributeKey<String> STEP = AttributeKey.stringKey("failover.step");
    private static final AttributeKey<Long> ATTEMPT = AttributeKey.longKey("failover.attempt");
    
    private final List<FailoverStep> steps;
    private final Fleet fleet;
    private final FailoverEventStore eventStore;
    private final ExecutorService stepRunner;
    private final Notifier notifier;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Tracer tracer;
    private final Clock clock;
    
    public FailoverExecutor(List<FailoverStep> steps,
                            Fleet fleet,
                            FailoverEventStore eventStore,
                            @Qualifier(SchedulingConfig.STEP_RUNNER) ExecutorService stepRunner,
                            Notifier notifier,
                            MetricsRegistry metricsRegistry,
                            StructuredLogger structuredLogger,
                            Tracer tracer,
                            Clock clock) {
        this.steps = List.copyOf(steps);
        this.fleet = fleet;
        this.eventStore = eventStore;
        this.stepRunner = stepRunner;
        this.notifier = notifier;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.tracer = tracer;
        this.clock = clock;
        log.info("Failover executor configured with steps {}", stepNames());
    }
    
    public List<String> stepNames() {
        return steps.stream().map(FailoverStep::name).toList();
    }
    
    /**
     * Run every step that has not yet succeeded, in order.
     * Never skips a step: the first step that exhausts its retries ends the run.
     */
    public ExecutionResult execute(FailoverEvent event, CancellationToken token) {
        StepRetryPolicy policy = policyFor(event);
        LoggingConfig.setDecisionContext(event.getServiceId(), null);
        LoggingConfig.setFailoverContext(event.getId());
        try {
            for (FailoverStep step : steps) {
                if (event.hasSucceeded(step.name())) {
                    log.debug("Step {} of {} already succeeded, skipping", step.name(), event.getId());
                    continue;
                }
                if (token.isCancelled()) {
                    return ExecutionResult.cancelled(step.name(), token.reason());
                }
                
                StepOutcome outcome = runWithRetry(event, step, policy, token, step::execute, false);
                if (outcome == StepOutcome.CANCELLED) {
                    return ExecutionResult.cancelled(step.name(), token.reason());
                }
                if (outcome != StepOutcome.SUCCEEDED) {
                    return ExecutionResult.failed(step.name(),
                        "step exhausted " + policy.maxAttempts() + " attempts");
                }
            }
            return ExecutionResult.completed();
        } finally {
            LoggingConfig.clearDecisionContext();
        }
    }
    
    /**
     * Compensate every attempted, not yet compensated step in reverse order.
     * 
     * @throws RollbackException if a compensation exhausts its retries
     */
    public void rollback(FailoverEvent event) {
        StepRetryPolicy policy = policyFor(event);
        CancellationToken uncancellable = new CancellationToken();
        List<FailoverStep> reversed = new ArrayList<>(steps);
        Collections.reverse(reversed);
        
        LoggingConfig.setDecisionContext(event.getServiceId(), null);
        LoggingConfig.setFailoverContext(event.getId());
        try {
            for (FailoverStep step : reversed) {
                Optional<StepOutcome> latest = event.latestOutcome(step.name());
                if (latest.isEmpty() || latest.get() == StepOutcome.COMPENSATED) {
                    continue;
                }
                StepOutcome outcome = runWithRetry(event, step, policy, uncancellable, step::compensate, true);
                if (outcome != StepOutcome.COMPENSATED) {
                    throw new RollbackException(event.getId(), step.name(),
                        "compensation exhausted " + policy.maxAttempts() + " attempts", null);
                }
            }
        } finally {
            LoggingConfig.clearDecisionContext();
        }
    }
    
    private StepOutcome runWithRetry(FailoverEvent event, FailoverStep step, StepRetryPolicy policy,
                                     CancellationToken token, Function<FailoverEvent, StepResult> action,
                                     boolean compensating) {
        StepOutcome last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            last = runAttempt(event, step, attempt, policy.stepTimeout(), token, action, compensating);
            if (last == StepOutcome.SUCCEEDED || last == StepOutcome.COMPENSATED || last == StepOutcome.CANCELLED) {
                return last;
            }
            
            if (attempt < policy.maxAttempts()) {
                Duration delay = policy.delayAfter(attempt);
                log.warn("Step {}{} of {} failed (attempt {}/{}), retrying in {}ms",
                    step.name(), compensating ? " compensation" : "", event.getId(),
                    attempt, policy.maxAttempts(), delay.toMillis());
                try {
                    if (token.sleep(delay)) {
                        append(event, step, attempt + 1, StepOutcome.CANCELLED, clock.instant(),
                            "cancelled during backoff: " + token.reason());
                        return StepOutcome.CANCELLED;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    append(event, step, attempt + 1, StepOutcome.CANCELLED, clock.instant(), "worker interrupted");
                    return StepOutcome.CANCELLED;
                }
            }
        }
        log.error("Step {}{} of {} failed after {} attempts", step.name(),
            compensating ? " compensation" : "", event.getId(), policy.maxAttempts());
        return last;
    }
    
    private StepOutcome runAttempt(FailoverEvent event, FailoverStep step, int attempt, Duration timeout,
                                   CancellationToken token, Function<FailoverEvent, StepResult> action,
                                   boolean compensating) {
        Instant startedAt = clock.instant();
        Span span = tracer.spanBuilder((compensating ? "failover.compensate." : "failover.step.") + step.name())
            .setAttribute(SERVICE_ID, event.getServiceId())
            .setAttribute(EVENT_ID, event.getId())
            .setAttribute(STEP, step.name())
            .setAttribute(ATTEMPT, (long) attempt)
            .startSpan();
        
        StepOutcome outcome;
        String detail;
        try (Scope ignored = span.makeCurrent()) {
            Callable<StepResult> call = () -> action.apply(event);
            Future<StepResult> pending = stepRunner.submit(Context.current().wrap(call));
            token.attach(pending);
            try {
                StepResult result = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                detail = result.detail();
                if (result.isSuccess()) {
                    outcome = compensating ? StepOutcome.COMPENSATED : StepOutcome.SUCCEEDED;
                } else {
                    outcome = compensating ? StepOutcome.COMPENSATION_FAILED : StepOutcome.FAILED;
                }
            } catch (TimeoutException e) {
                pending.cancel(true);
                outcome = compensating ? StepOutcome.COMPENSATION_FAILED : StepOutcome.TIMED_OUT;
                detail = "no result within " + timeout.toMillis() + "ms";
            } catch (CancellationException e) {
                outcome = StepOutcome.CANCELLED;
                detail = "cancelled: " + token.reason();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                outcome = compensating ? StepOutcome.COMPENSATION_FAILED : StepOutcome.FAILED;
                detail = cause.getMessage();
                span.recordException(cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.cancel(true);
                outcome = StepOutcome.CANCELLED;
                detail = "worker interrupted";
            } finally {
                token.detach();
            }
            
            if (outcome == StepOutcome.SUCCEEDED || outcome == StepOutcome.COMPENSATED) {
                span.setStatus(StatusCode.OK);
            } else {
                span.setStatus(StatusCode.ERROR, outcome.name());
            }
        } finally {
            span.end();
        }
        
        append(event, step, attempt, outcome, startedAt, detail);
        return outcome;
    }
    
    private void append(FailoverEvent event, FailoverStep step, int attempt, StepOutcome outcome,
                        Instant startedAt, String detail) {
        Instant finishedAt = clock.instant();
        event.record(new StepRecord(step.name(), attempt, outcome, startedAt, finishedAt, detail));
        eventStore.save(event);
        
        long durationMs = Duration.between(startedAt, finishedAt).toMillis();
        metricsRegistry.recordStepOutcome(event.getServiceId(), step.name(), outcome.name());
        structuredLogger.failover().step(event.getId(), event.getServiceId(), step.name(), attempt,
            outcome.name(), durationMs, detail);
        
        boolean good = outcome == StepOutcome.SUCCEEDED || outcome == StepOutcome.COMPENSATED;
        Notifications.publishQuietly(notifier, AvailabilityEvent.create(
            good ? AvailabilityEvent.EventType.FAILOVER_STEP_COMPLETED : AvailabilityEvent.EventType.FAILOVER_STEP_FAILED,
            event.getServiceId(),
            event.getToRegion(),
            String.format("Step %s attempt %d: %s", step.name(), attempt, outcome),
            Map.of(
                "failoverEventId", event.getId(),
                "step", step.name(),
                "attempt", attempt,
                "outcome", outcome.name(),
                "detail", detail != null ? detail : ""
            )
        ));
    }
    
    private StepRetryPolicy policyFor(FailoverEvent event) {
        return StepRetryPolicy.from(fleet.service(event.getServiceId()).thresholds());
    }
}
