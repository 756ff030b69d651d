package com.platform.failover.coordinator;

import com.platform.failover.coordinator.DecisionSignal.ExecutionFinished;
import com.platform.failover.coordinator.DecisionSignal.Resume;
import com.platform.failover.coordinator.DecisionSignal.RollbackFinished;
import com.platform.failover.coordinator.DecisionSignal.Sample;
import com.platform.failover.coordinator.DecisionSignal.Tick;
import com.platform.failover.coordinator.DecisionSignal.VerificationFinished;
import com.platform.failover.detector.FailureDetector;
import com.platform.failover.error.ConflictException;
import com.platform.failover.error.FailoverAlreadyInProgressException;
import com.platform.failover.error.RollbackException;
import com.platform.failover.error.UnauthorizedOverrideException;
import com.platform.failover.executor.CancellationToken;
import com.platform.failover.executor.ExecutionResult;
import com.platform.failover.model.AvailabilityEvent;
import com.platform.failover.model.AvailabilityEvent.EventType;
import com.platform.failover.model.FailoverEvent;
import com.platform.failover.model.FailoverPhase;
import com.platform.failover.model.FailoverTrigger;
import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.Region;
import com.platform.failover.model.RegionDefinition;
import com.platform.failover.model.RegionRole;
import com.platform.failover.model.RegionState;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.notify.Notifications;
import com.platform.failover.slo.SloTracker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Failover state machine of one service.
 * 
 * Only the service's decision loop calls {@link #handle}; long-running work (step execution,
 * verification, rollback) runs on the worker pool and reports back through the loop as
 * another signal. At most one failover event is live per service: the coordinator opens one
 * only from {@code STABLE} or {@code EVALUATING} and the event store refuses a second.
 */
@Slf4j
public class FailoverCoordinator {
    
    static final String SYSTEM_ACTOR = "failover-controller";
    
    private final ServiceDefinition service;
    private final FailureDetector detector;
    private final CoordinatorContext ctx;
    private final Consumer<DecisionSignal> loopback;
    
    private CoordinatorState state = CoordinatorState.STABLE;
    private String primary;
    private String target;
    private FailoverEvent liveEvent;
    private CancellationToken token;
    private boolean abortRequested;
    private String abortReason;
    private Instant hardBurnSince;
    private Instant since;
    private String reason = "initial";
    
    private volatile CoordinatorSnapshot snapshot;
    
    public FailoverCoordinator(ServiceDefinition service, FailureDetector detector, CoordinatorContext ctx,
                               Consumer<DecisionSignal> loopback) {
        this.service = service;
        this.detector = detector;
        this.ctx = ctx;
        this.loopback = loopback;
        this.primary = ctx.stateStore().primaryOf(service.serviceId());
        this.since = ctx.clock().instant();
        publishSnapshot();
    }
    
    public void handle(DecisionSignal signal) {
        if (signal instanceof Sample s) {
            onSample(s.sample());
        } else if (signal instanceof Tick t) {
            onTick(t.at());
        } else if (signal instanceof OverrideSignal o) {
            onOverride(o);
        } else if (signal instanceof ExecutionFinished f) {
            onExecutionFinished(f);
        } else if (signal instanceof VerificationFinished v) {
            onVerificationFinished(v);
        } else if (signal instanceof RollbackFinished r) {
            onRollbackFinished(r);
        } else if (signal instanceof Resume r) {
            resume(r.event());
        }
    }
    
    public CoordinatorSnapshot snapshot() {
        return snapshot;
    }
    
    /**
     * Pick up the primary designation from the store. Only valid before the loop starts.
     */
    void reloadPrimary() {
        primary = ctx.stateStore().primaryOf(service.serviceId());
        publishSnapshot();
    }
    
    // -- detection and triggering ---------------------------------------------------------
    
    private void onSample(ProbeSample sample) {
        detector.onSample(sample);
        Instant now = ctx.clock().instant();
        if (state == CoordinatorState.STABLE) {
            checkTriggers(now);
        } else if (state == CoordinatorState.EVALUATING) {
            trackHardBurn(now);
            maybeCancelEvaluation();
        }
    }
    
    private void onTick(Instant at) {
        detector.reconcileAll();
        Instant now = ctx.clock().instant();
        switch (state) {
            case STABLE -> checkTriggers(now);
            case EVALUATING -> {
                trackHardBurn(now);
                if (!maybeCancelEvaluation()) {
                    evaluateTargets();
                }
            }
            default -> log.trace("Tick for {} in {}", service.serviceId(), state);
        }
    }
    
    private void checkTriggers(Instant now) {
        Region current = ctx.stateStore().get(service.serviceId(), primary);
        boolean hardBurnSustained = trackHardBurn(now);
        
        String why = null;
        if (current.state() == RegionState.UNREACHABLE) {
            why = "primary " + primary + " unreachable";
        } else if (hardBurnSustained) {
            why = String.format("burn rate above %.1f on %s for at least %s",
                service.thresholds().hardBurnRate(), primary, service.rto());
        }
        if (why == null) {
            return;
        }
        
        moveTo(CoordinatorState.EVALUATING, why);
        publish(EventType.FAILOVER_EVALUATION_STARTED, primary, why, Map.of());
        evaluateTargets();
    }
    
    /**
     * @return true once the short-window burn of the primary has stayed above the hard
     *         threshold for at least the service's RTO
     */
    private boolean trackHardBurn(Instant now) {
        double burn = ctx.sloTracker().burnRate(service.serviceId(), primary, SloTracker.SHORT_WINDOW);
        if (burn > service.thresholds().hardBurnRate()) {
            if (hardBurnSince == null) {
                hardBurnSince = now;
            }
        } else {
            hardBurnSince = null;
        }
        return hardBurnSince != null && !hardBurnSince.plus(service.rto()).isAfter(now);
    }
    
    private boolean maybeCancelEvaluation() {
        Region current = ctx.stateStore().get(service.serviceId(), primary);
        if (current.state() != RegionState.HEALTHY || hardBurnSince != null) {
            return false;
        }
        String why = "primary " + primary + " healthy again";
        moveTo(CoordinatorState.STABLE, why);
        publish(EventType.FAILOVER_EVALUATION_CANCELLED, primary, why, Map.of());
        return true;
    }
    
    private void evaluateTargets() {
        TargetSelector.Selection selection = ctx.targetSelector().select(service, primary);
        if (selection.target().isPresent()) {
            openFailover(selection.target().get(), FailoverTrigger.AUTOMATIC, SYSTEM_ACTOR, reason);
            return;
        }
        
        String why = "no candidate qualifies: " + selection.rejections();
        log.warn("Failover of {} blocked, {}", service.serviceId(), why);
        Map<String, Object> metadata = new LinkedHashMap<>(selection.rejectionsAsMetadata());
        metadata.put("rpoSeconds", service.rpo().toSeconds());
        publish(EventType.FAILOVER_TARGET_UNQUALIFIED, primary,
            "No failover target for " + service.serviceId() + " meets health and RPO criteria", metadata);
    }
    
    // -- failover lifecycle ---------------------------------------------------------------
    
    private boolean openFailover(String targetRegion, FailoverTrigger trigger, String actor, String why) {
        FailoverEvent event = FailoverEvent.open(service.serviceId(), primary, targetRegion, trigger, actor,
            ctx.clock().instant());
        try {
            ctx.eventStore().open(event);
        } catch (FailoverAlreadyInProgressException e) {
            log.warn("Refusing to open failover of {} to {}: {}", service.serviceId(), targetRegion, e.getMessage());
            return false;
        }
        
        liveEvent = event;
        target = targetRegion;
        token = new CancellationToken();
        abortRequested = false;
        abortReason = null;
        
        ctx.structuredLogger().failover().opened(event.getId(), service.serviceId(), primary, targetRegion, actor);
        moveTo(CoordinatorState.FAILOVER_IN_PROGRESS, why);
        publish(EventType.FAILOVER_STARTED, targetRegion,
            String.format("Failover of %s from %s to %s started (%s)", service.serviceId(), primary, targetRegion, trigger),
            Map.of("failoverEventId", event.getId(), "from", primary, "to", targetRegion, "trigger", trigger.name()));
        startExecution(event, token);
        return true;
    }
    
    private void startExecution(FailoverEvent event, CancellationToken cancellation) {
        ctx.worker().execute(() -> {
            ExecutionResult result;
            try {
                result = ctx.executor().execute(event, cancellation);
            } catch (RuntimeException e) {
                log.error("Execution of failover {} failed unexpectedly", event.getId(), e);
                result = ExecutionResult.failed("executor", e.getMessage());
            }
            loopback.accept(new ExecutionFinished(service.serviceId(), event.getId(), result));
        });
    }
    
    private void onExecutionFinished(ExecutionFinished finished) {
        if (!isCurrent(finished.eventId(), CoordinatorState.FAILOVER_IN_PROGRESS)) {
            return;
        }
        ExecutionResult result = finished.result();
        
        if (abortRequested) {
            beginRollback("aborted by operator: " + abortReason);
        } else if (result.isCompleted()) {
            beginVerification();
        } else if (result.status() == ExecutionResult.Status.CANCELLED) {
            beginRollback("execution cancelled at " + result.failedStep());
        } else {
            beginRollback("step " + result.failedStep() + " failed: " + result.detail());
        }
    }
    
    private void beginVerification() {
        if (!advancePhase(FailoverPhase.VERIFYING, "all steps succeeded")) {
            return;
        }
        FailoverEvent event = liveEvent;
        moveTo(CoordinatorState.VERIFYING, "verifying " + target);
        publish(EventType.FAILOVER_VERIFYING, target, "Verifying new primary " + target,
            Map.of("failoverEventId", event.getId()));
        
        RegionDefinition definition = service.region(target).orElseThrow();
        CancellationToken cancellation = token;
        int probes = service.thresholds().verificationProbes();
        Duration spacing = service.thresholds().verificationInterval();
        
        ctx.worker().execute(() -> {
            boolean passed = true;
            String detail = probes + " probes passed";
            try {
                for (int i = 1; i <= probes; i++) {
                    ProbeSample sample = ctx.probeRegistry().probe(service, definition);
                    if (!sample.isSuccess()) {
                        passed = false;
                        detail = String.format("probe %d/%d %s: %s", i, probes, sample.outcome(), sample.detail());
                        break;
                    }
                    if (i < probes && cancellation.sleep(spacing)) {
                        passed = false;
                        detail = "verification cancelled: " + cancellation.reason();
                        break;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                passed = false;
                detail = "verification interrupted";
            } catch (RuntimeException e) {
                passed = false;
                detail = "verification error: " + e.getMessage();
            }
            loopback.accept(new VerificationFinished(service.serviceId(), event.getId(), passed, detail));
        });
    }
    
    private void onVerificationFinished(VerificationFinished finished) {
        if (!isCurrent(finished.eventId(), CoordinatorState.VERIFYING)) {
            return;
        }
        if (abortRequested) {
            beginRollback("aborted by operator: " + abortReason);
        } else if (finished.passed()) {
            completeFailover(finished.detail());
        } else {
            beginRollback("verification failed, " + finished.detail());
        }
    }
    
    private void completeFailover(String detail) {
        String oldPrimary = primary;
        String newPrimary = target;
        if (!advancePhase(FailoverPhase.COMPLETED, detail)) {
            return;
        }
        FailoverEvent event = liveEvent;
        
        withOneRetry(() -> ctx.stateStore().compareAndSetPrimary(service.serviceId(), oldPrimary, newPrimary));
        withOneRetry(() -> setRole(newPrimary, RegionRole.PRIMARY));
        withOneRetry(() -> setRole(oldPrimary, RegionRole.STANDBY));
        withOneRetry(() -> {
            Region promoted = ctx.stateStore().get(service.serviceId(), newPrimary);
            if (promoted.state() == RegionState.PROMOTED) {
                ctx.stateStore().compareAndSetState(service.serviceId(), newPrimary,
                    RegionState.PROMOTED, RegionState.HEALTHY);
            }
        });
        
        primary = newPrimary;
        hardBurnSince = null;
        clearLive();
        moveTo(CoordinatorState.STABLE, "failover to " + newPrimary + " completed");
        publish(EventType.FAILOVER_COMPLETED, newPrimary,
            String.format("%s now served from %s (was %s)", service.serviceId(), newPrimary, oldPrimary),
            Map.of("failoverEventId", event.getId(), "from", oldPrimary, "to", newPrimary));
    }
    
    private void beginRollback(String why) {
        if (!advancePhase(FailoverPhase.ROLLING_BACK, why)) {
            return;
        }
        FailoverEvent event = liveEvent;
        moveTo(CoordinatorState.ROLLING_BACK, why);
        publish(EventType.FAILOVER_ROLLING_BACK, event.getFromRegion(), why,
            Map.of("failoverEventId", event.getId()));
        startRollback(event);
    }
    
    private void startRollback(FailoverEvent event) {
        ctx.worker().execute(() -> {
            boolean ok = true;
            String detail = "compensated";
            try {
                ctx.executor().rollback(event);
            } catch (RollbackException e) {
                ok = false;
                detail = e.getMessage();
            } catch (RuntimeException e) {
                log.error("Rollback of failover {} failed unexpectedly", event.getId(), e);
                ok = false;
                detail = e.getMessage();
            }
            loopback.accept(new RollbackFinished(service.serviceId(), event.getId(), ok, detail));
        });
    }
    
    private void onRollbackFinished(RollbackFinished finished) {
        if (!isCurrent(finished.eventId(), CoordinatorState.ROLLING_BACK)) {
            return;
        }
        String eventId = liveEvent.getId();
        
        if (!finished.succeeded()) {
            String why = "rollback failed, manual intervention required: " + finished.detail();
            log.error("Failover {} of {}: {}", eventId, service.serviceId(), why);
            if (advancePhase(FailoverPhase.ABORTED, why)) {
                clearLive();
                enterAborted(why);
            }
            return;
        }
        if (abortRequested) {
            String why = "aborted by operator: " + abortReason;
            if (advancePhase(FailoverPhase.ABORTED, why)) {
                clearLive();
                enterAborted(why);
            }
            return;
        }
        
        if (!advancePhase(FailoverPhase.ROLLED_BACK, finished.detail())) {
            return;
        }
        clearLive();
        moveTo(CoordinatorState.STABLE, "rolled back to " + primary);
        publish(EventType.FAILOVER_ROLLED_BACK, primary,
            String.format("Failover of %s rolled back, %s remains primary", service.serviceId(), primary),
            Map.of("failoverEventId", eventId));
    }
    
    private void resume(FailoverEvent event) {
        if (liveEvent != null) {
            log.warn("Ignoring resume of {} for {}: {} already live", event.getId(), service.serviceId(),
                liveEvent.getId());
            return;
        }
        liveEvent = event;
        primary = event.getFromRegion();
        target = event.getToRegion();
        token = new CancellationToken();
        abortRequested = false;
        
        ctx.structuredLogger().failover().resumed(event.getId(), service.serviceId(), event.getPhase().name());
        log.info("Resuming failover {} of {} in phase {}", event.getId(), service.serviceId(), event.getPhase());
        
        switch (event.getPhase()) {
            case EXECUTING -> {
                moveTo(CoordinatorState.FAILOVER_IN_PROGRESS, "resumed after restart");
                startExecution(event, token);
            }
            case VERIFYING -> {
                moveTo(CoordinatorState.FAILOVER_IN_PROGRESS, "resumed after restart");
                beginVerification();
            }
            case ROLLING_BACK -> {
                moveTo(CoordinatorState.ROLLING_BACK, "resumed after restart");
                startRollback(event);
            }
            default -> {
                log.warn("Failover {} is already {}", event.getId(), event.getPhase());
                clearLive();
            }
        }
    }
    
    // -- manual overrides -----------------------------------------------------------------
    
    private void onOverride(OverrideSignal signal) {
        try {
            ctx.authorizer().authorize(signal.operator(), signal.token());
        } catch (UnauthorizedOverrideException e) {
            rejectOverride(signal, "unauthorized operator");
            return;
        }
        
        switch (signal.type()) {
            case ABORT -> abort(signal);
            case FORCE_FAILOVER -> forceFailover(signal);
            case CLEAR_ABORT -> clearAbort(signal);
        }
    }
    
    private void abort(OverrideSignal signal) {
        String why = "aborted by " + signal.operator() + ": " + signal.reason();
        switch (state) {
            case STABLE, EVALUATING -> {
                acceptOverride(signal);
                enterAborted(why);
            }
            case FAILOVER_IN_PROGRESS, VERIFYING, ROLLING_BACK -> {
                acceptOverride(signal);
                abortRequested = true;
                abortReason = signal.operator() + ": " + signal.reason();
                token.cancel(why);
                log.warn("Abort requested for failover {} of {}", liveEvent.getId(), service.serviceId());
            }
            case ABORTED -> rejectOverride(signal, "already aborted");
        }
    }
    
    private void forceFailover(OverrideSignal signal) {
        if (state != CoordinatorState.STABLE && state != CoordinatorState.EVALUATING) {
            rejectOverride(signal, "cannot force failover while " + state);
            return;
        }
        TargetSelector.Selection selection =
            ctx.targetSelector().selectForced(service, primary, signal.targetRegion());
        if (selection.target().isEmpty()) {
            rejectOverride(signal, "no eligible target: " + selection.rejections());
            return;
        }
        
        acceptOverride(signal);
        String why = "forced by " + signal.operator() + ": " + signal.reason();
        if (!openFailover(selection.target().get(), FailoverTrigger.MANUAL, signal.operator(), why)) {
            log.warn("Forced failover of {} not started, another failover is live", service.serviceId());
        }
    }
    
    private void clearAbort(OverrideSignal signal) {
        if (state != CoordinatorState.ABORTED) {
            rejectOverride(signal, "not aborted");
            return;
        }
        acceptOverride(signal);
        primary = ctx.stateStore().primaryOf(service.serviceId());
        hardBurnSince = null;
        String why = "abort cleared by " + signal.operator() + ": " + signal.reason();
        moveTo(CoordinatorState.STABLE, why);
        publish(EventType.ABORT_CLEARED, primary, why, Map.of("operator", signal.operator()));
    }
    
    private void acceptOverride(OverrideSignal signal) {
        ctx.structuredLogger().override().accepted(service.serviceId(), signal.type().name(), signal.operator(),
            signal.reason(), signal.targetRegion());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("type", signal.type().name());
        metadata.put("operator", signal.operator());
        metadata.put("reason", String.valueOf(signal.reason()));
        if (signal.targetRegion() != null) {
            metadata.put("targetRegion", signal.targetRegion());
        }
        publish(EventType.OVERRIDE_RECEIVED, signal.targetRegion(), signal.toString(), metadata);
    }
    
    private void rejectOverride(OverrideSignal signal, String why) {
        log.warn("Override {} for {} rejected: {}", signal.type(), service.serviceId(), why);
        ctx.structuredLogger().override().rejected(service.serviceId(), signal.type().name(), signal.operator(), why);
        ctx.metricsRegistry().incrementCounter("failover.overrides.rejected", "service", service.serviceId());
        publish(EventType.OVERRIDE_REJECTED, signal.targetRegion(), why,
            Map.of("type", signal.type().name(), "operator", String.valueOf(signal.operator())));
    }
    
    private void enterAborted(String why) {
        moveTo(CoordinatorState.ABORTED, why);
        publish(EventType.FAILOVER_ABORTED, primary, why, Map.of());
    }
    
    // -- helpers --------------------------------------------------------------------------
    
    private boolean isCurrent(String eventId, CoordinatorState expected) {
        if (liveEvent == null || !liveEvent.getId().equals(eventId)) {
            log.warn("Ignoring stale signal for failover {} of {}", eventId, service.serviceId());
            return false;
        }
        if (state != expected) {
            log.warn("Ignoring signal for failover {} in state {}, expected {}", eventId, state, expected);
            return false;
        }
        return true;
    }
    
    /**
     * Persist the live event in {@code phase}, then adopt it. When the store refuses the write
     * the in-memory event keeps its old phase and the coordinator goes to ABORTED.
     * 
     * @return false if the phase could not be recorded
     */
    private boolean advancePhase(FailoverPhase phase, String why) {
        FailoverEvent current = liveEvent;
        if (current.getPhase() != phase) {
            FailoverEvent next = current.withPhase(phase, ctx.clock().instant(), why);
            try {
                ctx.eventStore().save(next);
            } catch (RuntimeException e) {
                eventNotRecorded(current, phase, e);
                return false;
            }
            liveEvent = next;
        }
        if (phase.isTerminal()) {
            ctx.structuredLogger().failover().finished(current.getId(), service.serviceId(), phase.name(), why);
        }
        return true;
    }
    
    private void eventNotRecorded(FailoverEvent event, FailoverPhase phase, RuntimeException cause) {
        String why = String.format("could not record %s of failover %s, manual intervention required: %s",
            phase, event.getId(), cause.getMessage());
        log.error("Failover {} of {}: {}", event.getId(), service.serviceId(), why, cause);
        ctx.metricsRegistry().incrementCounter("failover.coordinator.store_errors", "service", service.serviceId());
        if (token != null) {
            token.cancel(why);
        }
        clearLive();
        enterAborted(why);
    }
    
    private void setRole(String regionId, RegionRole role) {
        Region current = ctx.stateStore().get(service.serviceId(), regionId);
        if (current.role() != role) {
            ctx.stateStore().compareAndSet(service.serviceId(), regionId, current.state(), r -> r.withRole(role));
        }
    }
    
    private void withOneRetry(Runnable update) {
        try {
            update.run();
        } catch (ConflictException first) {
            try {
                update.run();
            } catch (ConflictException second) {
                log.warn("Deferred store update for {}: {}", service.serviceId(), second.getMessage());
                ctx.structuredLogger().detector().conflictDeferred(service.serviceId(), null, second.getMessage());
            }
        }
    }
    
    private void clearLive() {
        liveEvent = null;
        target = null;
        token = null;
    }
    
    private void moveTo(CoordinatorState next, String why) {
        CoordinatorState previous = state;
        state = next;
        reason = why;
        since = ctx.clock().instant();
        publishSnapshot();
        
        if (previous == next) {
            return;
        }
        log.info("Coordinator {} {} -> {} ({})", service.serviceId(), previous, next, why);
        ctx.metricsRegistry().recordCoordinatorTransition(service.serviceId(), previous, next);
        ctx.structuredLogger().failover().coordinatorTransition(service.serviceId(), previous.name(), next.name(), why);
        publish(EventType.COORDINATOR_STATE_CHANGED, target != null ? target : primary, why,
            Map.of("from", previous.name(), "to", next.name()));
    }
    
    private void publishSnapshot() {
        snapshot = new CoordinatorSnapshot(
            service.serviceId(),
            state,
            primary,
            target,
            liveEvent != null ? liveEvent.getId() : null,
            since,
            reason
        );
    }
    
    private void publish(EventType type, String regionId, String message, Map<String, Object> metadata) {
        Notifications.publishQuietly(ctx.notifier(),
            AvailabilityEvent.create(type, service.serviceId(), regionId, message, metadata));
    }
    
    CoordinatorState state() {
        return state;
    }
    
    Optional<FailoverEvent> liveEvent() {
        return Optional.ofNullable(liveEvent);
    }
}
