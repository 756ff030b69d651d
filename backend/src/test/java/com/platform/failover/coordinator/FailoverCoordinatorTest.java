package com.platform.failover.coordinator;

import com.platform.failover.config.Fleet;
import com.platform.failover.config.FleetProperties;
import com.platform.failover.config.OverrideAuthorizer;
import com.platform.failover.connectors.ReplicationLagProvider;
import com.platform.failover.detector.FailureDetector;
import com.platform.failover.executor.FailoverExecutor;
import com.platform.failover.model.AvailabilityEvent;
import com.platform.failover.model.AvailabilityEvent.EventType;
import com.platform.failover.model.FailoverEvent;
import com.platform.failover.model.FailoverPhase;
import com.platform.failover.model.FailoverTrigger;
import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.RegionDefinition;
import com.platform.failover.model.RegionRole;
import com.platform.failover.model.RegionState;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.observability.MetricsRegistry;
import com.platform.failover.observability.StructuredLogger;
import com.platform.failover.persistence.InMemoryFailoverEventStore;
import com.platform.failover.probe.HealthProbeRegistry;
import com.platform.failover.slo.SloTracker;
import com.platform.failover.state.RegionStateStore;
import com.platform.failover.support.MutableClock;
import com.platform.failover.support.RecordingNotifier;
import com.platform.failover.support.ScriptedStep;
import com.platform.failover.support.TestFleets;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.platform.failover.support.ScriptedStep.fail;
import static com.platform.failover.support.TestFleets.CHECKOUT;
import static com.platform.failover.support.TestFleets.US_EAST;
import static com.platform.failover.support.TestFleets.US_WEST;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link FailoverCoordinator}.
 *
 * Worker jobs and loopback signals are queued and drained by the test, so every
 * interleaving is deterministic.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FailoverCoordinatorTest {

    @Mock
    private ReplicationLagProvider lagProvider;

    @Mock
    private HealthProbeRegistry probeRegistry;

    private final List<String> journal = new CopyOnWriteArrayList<>();
    private final Deque<Runnable> work = new ArrayDeque<>();
    private final Deque<DecisionSignal> signals = new ArrayDeque<>();

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private RecordingNotifier notifier;
    private RegionStateStore store;
    private RefusingEventStore eventStore;
    private ExecutorService stepRunner;
    private ScriptedStep quiesce;
    private ScriptedStep promote;
    private ScriptedStep route;
    private ScriptedStep resume;
    private FailoverCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        MetricsRegistry metrics = new MetricsRegistry(meterRegistry);
        StructuredLogger structuredLogger = new StructuredLogger("region-failover-controller", "test");
        notifier = new RecordingNotifier();

        ServiceDefinition checkout = TestFleets.checkout();
        Fleet fleet = TestFleets.fleetOf(checkout);
        store = new RegionStateStore(fleet, metrics);
        eventStore = new RefusingEventStore();
        SloTracker sloTracker = new SloTracker(fleet, store, metrics, clock);

        stepRunner = Executors.newCachedThreadPool();
        quiesce = new ScriptedStep("quiesce-writes", journal);
        promote = new ScriptedStep("promote-database", journal);
        route = new ScriptedStep("update-routing", journal);
        resume = new ScriptedStep("resume-writes", journal);
        FailoverExecutor executor = new FailoverExecutor(List.of(quiesce, promote, route, resume), fleet,
            eventStore, stepRunner, notifier, metrics, structuredLogger,
            OpenTelemetry.noop().getTracer("test"), clock);

        FleetProperties properties = new FleetProperties();
        properties.getOverrides().getOperatorTokens().put("alice", "test-token");

        when(lagProvider.replicationLag(anyString(), anyString())).thenReturn(Duration.ofSeconds(30));
        when(probeRegistry.probe(any(ServiceDefinition.class), any(RegionDefinition.class)))
            .thenAnswer(inv -> ProbeSample.success(CHECKOUT, US_WEST, clock.instant(), Duration.ofMillis(20)));

        CoordinatorContext ctx = new CoordinatorContext(sloTracker, store, eventStore, executor,
            new TargetSelector(store, lagProvider), probeRegistry, new OverrideAuthorizer(properties),
            notifier, metrics, structuredLogger, clock, work::add);
        FailureDetector detector = new FailureDetector(checkout, sloTracker, store, notifier, metrics,
            structuredLogger);
        coordinator = new FailoverCoordinator(checkout, detector, ctx, signals::add);
    }

    @AfterEach
    void tearDown() {
        stepRunner.shutdownNow();
    }

    /**
     * Run queued worker jobs and deliver their signals until both queues are empty.
     */
    private void drain() {
        while (!work.isEmpty() || !signals.isEmpty()) {
            Runnable job = work.pollFirst();
            if (job != null) {
                job.run();
                continue;
            }
            coordinator.handle(signals.pollFirst());
        }
    }

    private void sample(ProbeSample sample) {
        coordinator.handle(new DecisionSignal.Sample(sample));
        clock.advance(Duration.ofSeconds(10));
    }

    /**
     * Fail the primary every 10s until half the RTO has elapsed, which makes it unreachable.
     */
    private void primaryGoesDark() {
        for (int i = 0; i <= 15; i++) {
            sample(ProbeSample.failure(CHECKOUT, US_EAST, clock.instant(), Duration.ofMillis(15), "503"));
        }
    }

    /**
     * Event store that can be told to refuse every further write.
     */
    static class RefusingEventStore extends InMemoryFailoverEventStore {

        private volatile boolean refuseWrites;

        void refuseWrites() {
            refuseWrites = true;
        }

        @Override
        public synchronized void save(FailoverEvent event) {
            if (refuseWrites) {
                throw new DataAccessResourceFailureException("database unavailable");
            }
            super.save(event);
        }
    }

    private void tick() {
        coordinator.handle(new DecisionSignal.Tick(CHECKOUT, clock.instant()));
    }

    private OverrideSignal override(OverrideType type, String target) {
        return new OverrideSignal(type, CHECKOUT, target, "alice", "game day", "test-token");
    }

    private FailoverEvent onlyEvent() {
        List<FailoverEvent> events = eventStore.findByService(CHECKOUT);
        assertThat(events).hasSize(1);
        return events.get(0);
    }

    @Nested
    @DisplayName("Automatic failover")
    class AutomaticFailoverTests {

        @Test
        @DisplayName("unreachable primary fails over to the standby and ends stable on the new primary")
        void failsOverToStandby() {
            primaryGoesDark();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.FAILOVER_IN_PROGRESS);
            assertThat(store.get(CHECKOUT, US_EAST).state()).isEqualTo(RegionState.UNREACHABLE);

            drain();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            assertThat(coordinator.liveEvent()).isEmpty();
            assertThat(coordinator.snapshot().primary()).isEqualTo(US_WEST);
            assertThat(store.primaryOf(CHECKOUT)).isEqualTo(US_WEST);
            assertThat(store.get(CHECKOUT, US_WEST).role()).isEqualTo(RegionRole.PRIMARY);
            assertThat(store.get(CHECKOUT, US_EAST).role()).isEqualTo(RegionRole.STANDBY);

            FailoverEvent event = onlyEvent();
            assertThat(event.getPhase()).isEqualTo(FailoverPhase.COMPLETED);
            assertThat(event.getTrigger()).isEqualTo(FailoverTrigger.AUTOMATIC);
            assertThat(event.getTriggeredBy()).isEqualTo(FailoverCoordinator.SYSTEM_ACTOR);
            assertThat(journal).containsExactly("quiesce-writes", "promote-database", "update-routing",
                "resume-writes");
            assertThat(notifier.count(EventType.FAILOVER_STARTED)).isEqualTo(1);
            assertThat(notifier.count(EventType.FAILOVER_VERIFYING)).isEqualTo(1);
            assertThat(notifier.count(EventType.FAILOVER_COMPLETED)).isEqualTo(1);
        }

        @Test
        @DisplayName("sustained hard burn on a degraded but reachable primary triggers only after the RTO")
        void sustainedBurnTriggersAfterRto() {
            for (int i = 0; i < 30; i++) {
                sample(ProbeSample.success(CHECKOUT, US_EAST, clock.instant(), Duration.ofSeconds(2)));
                assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            }
            assertThat(store.get(CHECKOUT, US_EAST).state()).isEqualTo(RegionState.DEGRADED);
            assertThat(notifier.count(EventType.FAILOVER_EVALUATION_STARTED)).isZero();

            sample(ProbeSample.success(CHECKOUT, US_EAST, clock.instant(), Duration.ofSeconds(2)));

            assertThat(store.get(CHECKOUT, US_EAST).state()).isEqualTo(RegionState.DEGRADED);
            assertThat(coordinator.state()).isEqualTo(CoordinatorState.FAILOVER_IN_PROGRESS);
            assertThat(notifier.ofType(EventType.FAILOVER_EVALUATION_STARTED)).hasSize(1);
            assertThat(notifier.ofType(EventType.FAILOVER_EVALUATION_STARTED).get(0).message())
                .contains("burn rate above", "on us-east");

            drain();

            assertThat(store.primaryOf(CHECKOUT)).isEqualTo(US_WEST);
            assertThat(onlyEvent().getPhase()).isEqualTo(FailoverPhase.COMPLETED);
        }

        @Test
        @DisplayName("standby beyond the RPO blocks failover and is reported on every evaluation")
        void laggingStandbyBlocksFailover() {
            when(lagProvider.replicationLag(CHECKOUT, US_WEST)).thenReturn(Duration.ofMinutes(8));

            primaryGoesDark();
            tick();
            tick();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.EVALUATING);
            assertThat(eventStore.findByService(CHECKOUT)).isEmpty();
            assertThat(notifier.count(EventType.FAILOVER_TARGET_UNQUALIFIED)).isEqualTo(3);
            AvailabilityEvent unqualified = notifier.ofType(EventType.FAILOVER_TARGET_UNQUALIFIED).get(0);
            assertThat(unqualified.metadata()).containsEntry("rpoSeconds", 300L);
            assertThat(String.valueOf(unqualified.metadata().get(US_WEST))).contains("exceeds RPO");
        }

        @Test
        @DisplayName("operator can force the failover that the RPO blocked")
        void forcedFailoverIgnoresLag() {
            when(lagProvider.replicationLag(CHECKOUT, US_WEST)).thenReturn(Duration.ofMinutes(8));
            primaryGoesDark();

            coordinator.handle(override(OverrideType.FORCE_FAILOVER, US_WEST));
            drain();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            assertThat(store.primaryOf(CHECKOUT)).isEqualTo(US_WEST);
            FailoverEvent event = onlyEvent();
            assertThat(event.getTrigger()).isEqualTo(FailoverTrigger.MANUAL);
            assertThat(event.getTriggeredBy()).isEqualTo("alice");
            assertThat(notifier.count(EventType.OVERRIDE_RECEIVED)).isEqualTo(1);
        }

        @Test
        @DisplayName("evaluation is cancelled once the primary is healthy and its burn has cleared")
        void recoveredPrimaryCancelsEvaluation() {
            when(lagProvider.replicationLag(CHECKOUT, US_WEST)).thenReturn(Duration.ofMinutes(8));
            primaryGoesDark();

            for (int i = 0; i < 40 && coordinator.state() == CoordinatorState.EVALUATING; i++) {
                sample(ProbeSample.success(CHECKOUT, US_EAST, clock.instant(), Duration.ofMillis(20)));
            }

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            assertThat(store.get(CHECKOUT, US_EAST).state()).isEqualTo(RegionState.HEALTHY);
            assertThat(notifier.count(EventType.FAILOVER_EVALUATION_CANCELLED)).isEqualTo(1);
            assertThat(eventStore.findByService(CHECKOUT)).isEmpty();
        }

        @Test
        @DisplayName("never opens a second live event for a service")
        void singleLiveEvent() {
            primaryGoesDark();
            String liveId = coordinator.snapshot().liveEventId();

            coordinator.handle(override(OverrideType.FORCE_FAILOVER, US_WEST));

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.FAILOVER_IN_PROGRESS);
            assertThat(coordinator.snapshot().liveEventId()).isEqualTo(liveId);
            assertThat(eventStore.findAllLive()).hasSize(1);
            assertThat(notifier.ofType(EventType.OVERRIDE_REJECTED).get(0).message())
                .contains("FAILOVER_IN_PROGRESS");
        }

        @Test
        @DisplayName("stays evaluating when the store already holds a live event for the service")
        void storeRefusesSecondEvent() {
            eventStore.open(FailoverEvent.open(CHECKOUT, US_EAST, US_WEST, FailoverTrigger.MANUAL, "bob",
                clock.instant()));

            primaryGoesDark();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.EVALUATING);
            assertThat(coordinator.liveEvent()).isEmpty();
            assertThat(work).isEmpty();
        }
    }

    @Nested
    @DisplayName("Rollback")
    class RollbackTests {

        @Test
        @DisplayName("failed verification compensates in reverse and keeps the old primary")
        void failedVerificationRollsBack() {
            when(probeRegistry.probe(any(ServiceDefinition.class), any(RegionDefinition.class)))
                .thenAnswer(inv -> ProbeSample.failure(CHECKOUT, US_WEST, clock.instant(), Duration.ofMillis(5),
                    "502"));

            primaryGoesDark();
            drain();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            assertThat(store.primaryOf(CHECKOUT)).isEqualTo(US_EAST);
            assertThat(onlyEvent().getPhase()).isEqualTo(FailoverPhase.ROLLED_BACK);
            assertThat(journal).containsSubsequence("resume-writes:compensate", "update-routing:compensate",
                "promote-database:compensate", "quiesce-writes:compensate");
            assertThat(notifier.count(EventType.FAILOVER_ROLLED_BACK)).isEqualTo(1);
        }

        @Test
        @DisplayName("failed step rolls back only the steps that ran")
        void failedStepRollsBack() {
            promote.thenExecute(fail("replica lagging"), fail("replica lagging"), fail("replica lagging"));

            primaryGoesDark();
            drain();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            assertThat(onlyEvent().getPhase()).isEqualTo(FailoverPhase.ROLLED_BACK);
            assertThat(route.executeCalls()).isZero();
            assertThat(route.compensateCalls()).isZero();
            assertThat(journal).endsWith("promote-database:compensate", "quiesce-writes:compensate");
        }

        @Test
        @DisplayName("a phase the event store refuses to record aborts instead of leaving the failover hanging")
        void unrecordedPhaseAborts() {
            when(probeRegistry.probe(any(ServiceDefinition.class), any(RegionDefinition.class)))
                .thenAnswer(inv -> {
                    eventStore.refuseWrites();
                    return ProbeSample.success(CHECKOUT, US_WEST, clock.instant(), Duration.ofMillis(20));
                });

            primaryGoesDark();
            drain();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.ABORTED);
            assertThat(coordinator.liveEvent()).isEmpty();
            assertThat(coordinator.snapshot().reason()).contains("could not record COMPLETED", "manual intervention");
            assertThat(store.primaryOf(CHECKOUT)).isEqualTo(US_EAST);
            assertThat(onlyEvent().getPhase()).isEqualTo(FailoverPhase.VERIFYING);
            assertThat(meterRegistry.find("failover.coordinator.store_errors").counter().count()).isEqualTo(1.0);

            coordinator.handle(override(OverrideType.CLEAR_ABORT, null));

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            assertThat(coordinator.snapshot().primary()).isEqualTo(US_EAST);
        }

        @Test
        @DisplayName("failed compensation leaves the coordinator aborted")
        void failedRollbackAborts() {
            promote.thenExecute(fail("replica lagging"), fail("replica lagging"), fail("replica lagging"));
            quiesce.thenCompensate(fail("writes stuck"), fail("writes stuck"), fail("writes stuck"));

            primaryGoesDark();
            drain();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.ABORTED);
            assertThat(coordinator.liveEvent()).isEmpty();
            assertThat(onlyEvent().getPhase()).isEqualTo(FailoverPhase.ABORTED);
            assertThat(notifier.ofType(EventType.FAILOVER_ABORTED).get(0).message())
                .contains("manual intervention");
        }
    }

    @Nested
    @DisplayName("Manual overrides")
    class OverrideTests {

        @Test
        @DisplayName("abort while stable blocks automatic failover until cleared")
        void abortBlocksAutomaticFailover() {
            coordinator.handle(override(OverrideType.ABORT, null));
            assertThat(coordinator.state()).isEqualTo(CoordinatorState.ABORTED);

            primaryGoesDark();
            tick();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.ABORTED);
            assertThat(eventStore.findByService(CHECKOUT)).isEmpty();

            coordinator.handle(override(OverrideType.CLEAR_ABORT, null));

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            assertThat(notifier.count(EventType.ABORT_CLEARED)).isEqualTo(1);
        }

        @Test
        @DisplayName("abort during execution cancels, rolls back and ends aborted")
        void abortInFlight() {
            primaryGoesDark();
            assertThat(coordinator.state()).isEqualTo(CoordinatorState.FAILOVER_IN_PROGRESS);

            coordinator.handle(override(OverrideType.ABORT, null));
            drain();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.ABORTED);
            assertThat(store.primaryOf(CHECKOUT)).isEqualTo(US_EAST);
            assertThat(onlyEvent().getPhase()).isEqualTo(FailoverPhase.ABORTED);
            assertThat(route.executeCalls()).isZero();
        }

        @Test
        @DisplayName("a second abort and a clear outside aborted are rejected")
        void invalidOverridesRejected() {
            coordinator.handle(override(OverrideType.CLEAR_ABORT, null));
            coordinator.handle(override(OverrideType.ABORT, null));
            coordinator.handle(override(OverrideType.ABORT, null));

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.ABORTED);
            assertThat(notifier.count(EventType.OVERRIDE_REJECTED)).isEqualTo(2);
            assertThat(meterRegistry.find("failover.overrides.rejected").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("unauthorized operator is rejected without changing state")
        void unauthorizedRejected() {
            coordinator.handle(new OverrideSignal(OverrideType.FORCE_FAILOVER, CHECKOUT, US_WEST, "mallory",
                "let me in", "guess"));

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            assertThat(eventStore.findByService(CHECKOUT)).isEmpty();
            AvailabilityEvent rejected = notifier.ofType(EventType.OVERRIDE_REJECTED).get(0);
            assertThat(rejected.message()).isEqualTo("unauthorized operator");
        }

        @Test
        @DisplayName("forced failover to the current primary is rejected")
        void forcedToPrimaryRejected() {
            coordinator.handle(override(OverrideType.FORCE_FAILOVER, US_EAST));

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            assertThat(notifier.ofType(EventType.OVERRIDE_REJECTED).get(0).message()).contains("already primary");
        }
    }

    @Nested
    @DisplayName("Resume after restart")
    class ResumeTests {

        @Test
        @DisplayName("an event found verifying is verified again and completed")
        void resumesVerification() {
            FailoverEvent event = FailoverEvent.open(CHECKOUT, US_EAST, US_WEST, FailoverTrigger.AUTOMATIC,
                FailoverCoordinator.SYSTEM_ACTOR, clock.instant());
            event.moveTo(FailoverPhase.VERIFYING, clock.instant(), "all steps succeeded");
            eventStore.open(event);

            coordinator.handle(new DecisionSignal.Resume(CHECKOUT, event));
            drain();

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            assertThat(store.primaryOf(CHECKOUT)).isEqualTo(US_WEST);
            assertThat(eventStore.findById(event.getId())).get()
                .extracting(FailoverEvent::getPhase).isEqualTo(FailoverPhase.COMPLETED);
            assertThat(journal).isEmpty();
        }

        @Test
        @DisplayName("stale completion signals for an unknown event are ignored")
        void staleSignalIgnored() {
            coordinator.handle(new DecisionSignal.VerificationFinished(CHECKOUT, "no-such-event", true, "ok"));

            assertThat(coordinator.state()).isEqualTo(CoordinatorState.STABLE);
            assertThat(store.primaryOf(CHECKOUT)).isEqualTo(US_EAST);
        }
    }
}
