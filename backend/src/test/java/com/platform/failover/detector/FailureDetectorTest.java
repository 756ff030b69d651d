package com.platform.failover.detector;

import com.platform.failover.config.Fleet;
import com.platform.failover.error.ConfigurationException;
import com.platform.failover.model.AvailabilityEvent.EventType;
import com.platform.failover.model.FailoverThresholds;
import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.RegionState;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.observability.MetricsRegistry;
import com.platform.failover.observability.StructuredLogger;
import com.platform.failover.slo.SloTracker;
import com.platform.failover.state.RegionStateStore;
import com.platform.failover.support.MutableClock;
import com.platform.failover.support.RecordingNotifier;
import com.platform.failover.support.TestFleets;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.platform.failover.support.TestFleets.CHECKOUT;
import static com.platform.failover.support.TestFleets.US_EAST;
import static com.platform.failover.support.TestFleets.US_WEST;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FailureDetector}.
 */
class FailureDetectorTest {

    private MutableClock clock;
    private MetricsRegistry metrics;
    private RecordingNotifier notifier;
    private RegionStateStore store;
    private SloTracker sloTracker;
    private FailureDetector detector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        metrics = new MetricsRegistry(new SimpleMeterRegistry());
        notifier = new RecordingNotifier();
        ServiceDefinition checkout = TestFleets.checkout();
        Fleet fleet = TestFleets.fleetOf(checkout);
        store = new RegionStateStore(fleet, metrics);
        sloTracker = new SloTracker(fleet, store, metrics, clock);
        detector = new FailureDetector(checkout, sloTracker, store, notifier, metrics,
            new StructuredLogger("region-failover-controller", "test"));
    }

    private void fail(String region) {
        detector.onSample(ProbeSample.failure(CHECKOUT, region, clock.instant(), Duration.ofMillis(15), "503"));
        clock.advance(Duration.ofSeconds(10));
    }

    private void succeed(String region, Duration latency) {
        detector.onSample(ProbeSample.success(CHECKOUT, region, clock.instant(), latency));
        clock.advance(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("rejects thresholds where recovery is not stricter than degradation")
    void rejectsWeakHysteresis() {
        FailoverThresholds t = TestFleets.fastThresholds();
        FailoverThresholds weak = new FailoverThresholds(t.probeInterval(), t.probeTimeout(), 3,
            t.failureInterval(), 3, t.suspectBurnRate(), t.hardBurnRate(), t.shortWindow(), t.longWindow(),
            t.maxStepAttempts(), t.initialBackoff(), t.backoffMultiplier(), t.maxBackoff(), t.stepTimeout(),
            t.verificationProbes(), t.verificationInterval());
        ServiceDefinition service = TestFleets.checkout(weak);

        assertThatThrownBy(() -> new FailureDetector(service, sloTracker, store, notifier, metrics,
            new StructuredLogger("region-failover-controller", "test")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("successes-to-recover");
    }

    @Test
    @DisplayName("N failures degrade the region in the store and announce each phase change")
    void failuresDegradeRegion() {
        fail(US_EAST);
        assertThat(detector.phaseOf(US_EAST)).isEqualTo(DetectorPhase.SUSPECTED_DEGRADED);

        fail(US_EAST);
        fail(US_EAST);

        assertThat(detector.phaseOf(US_EAST)).isEqualTo(DetectorPhase.DEGRADED);
        assertThat(store.get(CHECKOUT, US_EAST).state()).isEqualTo(RegionState.DEGRADED);
        assertThat(store.get(CHECKOUT, US_EAST).consecutiveFailures()).isEqualTo(3);
        assertThat(notifier.count(EventType.REGION_STATE_CHANGED)).isEqualTo(2);
        assertThat(store.get(CHECKOUT, US_WEST).state()).isEqualTo(RegionState.HEALTHY);
    }

    @Test
    @DisplayName("region recovers after M successes once the short window clears")
    void regionRecovers() {
        fail(US_EAST);
        fail(US_EAST);
        fail(US_EAST);
        clock.advance(Duration.ofMinutes(6));

        for (int i = 0; i < 5; i++) {
            succeed(US_EAST, Duration.ofMillis(20));
        }

        assertThat(detector.phaseOf(US_EAST)).isEqualTo(DetectorPhase.HEALTHY);
        assertThat(store.get(CHECKOUT, US_EAST).state()).isEqualTo(RegionState.HEALTHY);
        assertThat(notifier.ofType(EventType.REGION_STATE_CHANGED))
            .extracting(e -> e.metadata().get("degrading"))
            .containsExactly(true, true, false, false);
    }

    @Test
    @DisplayName("slow successes burn the budget and raise an error budget event")
    void slowSuccessesBurnBudget() {
        succeed(US_EAST, Duration.ofSeconds(2));

        assertThat(detector.phaseOf(US_EAST)).isEqualTo(DetectorPhase.SUSPECTED_DEGRADED);
        assertThat(notifier.count(EventType.ERROR_BUDGET_BURNING)).isEqualTo(1);
    }

    @Test
    @DisplayName("does not overwrite a region owned by an in-flight promotion")
    void leavesPromotingRegionAlone() {
        store.compareAndSetState(CHECKOUT, US_WEST, RegionState.HEALTHY, RegionState.PROMOTING);

        fail(US_WEST);
        fail(US_WEST);
        fail(US_WEST);

        assertThat(detector.phaseOf(US_WEST)).isEqualTo(DetectorPhase.DEGRADED);
        assertThat(store.get(CHECKOUT, US_WEST).state()).isEqualTo(RegionState.PROMOTING);
    }

    @Test
    @DisplayName("reconcile re-applies the tracked phase once the executor releases a region")
    void reconcileAfterRelease() {
        store.compareAndSetState(CHECKOUT, US_WEST, RegionState.HEALTHY, RegionState.PROMOTING);
        fail(US_WEST);
        fail(US_WEST);
        fail(US_WEST);
        store.compareAndSetState(CHECKOUT, US_WEST, RegionState.PROMOTING, RegionState.FAILED);

        detector.reconcileAll();

        assertThat(store.get(CHECKOUT, US_WEST).state()).isEqualTo(RegionState.DEGRADED);
    }
}
