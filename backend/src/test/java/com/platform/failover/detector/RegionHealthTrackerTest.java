package com.platform.failover.detector;

import com.platform.failover.model.ProbeSample;
import com.platform.failover.support.TestFleets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static com.platform.failover.support.TestFleets.CHECKOUT;
import static com.platform.failover.support.TestFleets.US_EAST;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RegionHealthTracker}: N=3 failures in 60s to degrade, M=5 successes to recover,
 * RTO 5m.
 */
class RegionHealthTrackerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private RegionHealthTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new RegionHealthTracker(CHECKOUT, US_EAST, TestFleets.fastThresholds(), Duration.ofMinutes(5));
    }

    private Optional<DetectorTransition> fail(Instant at) {
        return tracker.observe(ProbeSample.failure(CHECKOUT, US_EAST, at, Duration.ofMillis(10), "503"), 0.0);
    }

    private Optional<DetectorTransition> succeed(Instant at, double burn) {
        return tracker.observe(ProbeSample.success(CHECKOUT, US_EAST, at, Duration.ofMillis(10)), burn);
    }

    private void degrade() {
        fail(T0);
        fail(T0.plusSeconds(10));
        fail(T0.plusSeconds(20));
        assertThat(tracker.phase()).isEqualTo(DetectorPhase.DEGRADED);
    }

    @Nested
    @DisplayName("Degradation")
    class DegradationTests {

        @Test
        @DisplayName("a single failure only raises suspicion")
        void singleFailureIsSuspected() {
            Optional<DetectorTransition> t = fail(T0);

            assertThat(t).isPresent();
            assertThat(t.get().from()).isEqualTo(DetectorPhase.HEALTHY);
            assertThat(t.get().to()).isEqualTo(DetectorPhase.SUSPECTED_DEGRADED);
            assertThat(tracker.consecutiveFailures()).isEqualTo(1);
        }

        @Test
        @DisplayName("N failures within the interval degrade the region")
        void nFailuresDegrade() {
            fail(T0);
            assertThat(fail(T0.plusSeconds(10))).isEmpty();
            Optional<DetectorTransition> t = fail(T0.plusSeconds(20));

            assertThat(t).isPresent();
            assertThat(t.get().to()).isEqualTo(DetectorPhase.DEGRADED);
            assertThat(t.get().isDegradation()).isTrue();
            assertThat(t.get().reason()).contains("3 consecutive failures");
        }

        @Test
        @DisplayName("failures spread wider than the interval do not degrade")
        void spreadFailuresStaySuspected() {
            fail(T0);
            fail(T0.plusSeconds(50));
            fail(T0.plusSeconds(100));

            assertThat(tracker.phase()).isEqualTo(DetectorPhase.SUSPECTED_DEGRADED);
        }

        @Test
        @DisplayName("failing for half the RTO makes the region unreachable")
        void unreachableAfterHalfRto() {
            degrade();
            assertThat(fail(T0.plusSeconds(120))).isEmpty();

            Optional<DetectorTransition> t = fail(T0.plusSeconds(150));

            assertThat(t).isPresent();
            assertThat(t.get().to()).isEqualTo(DetectorPhase.UNREACHABLE);
        }

        @Test
        @DisplayName("burn above the suspect rate alone raises suspicion")
        void burnRaisesSuspicion() {
            Optional<DetectorTransition> t = succeed(T0, 2.5);

            assertThat(t).isPresent();
            assertThat(t.get().to()).isEqualTo(DetectorPhase.SUSPECTED_DEGRADED);
            assertThat(t.get().reason()).startsWith("short-window burn");
        }

        @Test
        @DisplayName("hard burn sustained for the short window escalates a degraded region")
        void sustainedHardBurnEscalates() {
            tracker = new RegionHealthTracker(CHECKOUT, US_EAST, TestFleets.fastThresholds(), Duration.ofHours(1));
            Instant at = T0;
            for (int i = 0; i < 3; i++) {
                tracker.observe(ProbeSample.failure(CHECKOUT, US_EAST, at, Duration.ofMillis(10), "503"), 50.0);
                at = at.plusSeconds(10);
            }
            Optional<DetectorTransition> t = tracker.observe(
                ProbeSample.failure(CHECKOUT, US_EAST, T0.plus(Duration.ofMinutes(5)), Duration.ofMillis(10), "503"), 50.0);

            assertThat(t).isPresent();
            assertThat(t.get().to()).isEqualTo(DetectorPhase.UNREACHABLE);
            assertThat(t.get().reason()).contains("burn rate");
        }
    }

    @Nested
    @DisplayName("Recovery")
    class RecoveryTests {

        @Test
        @DisplayName("first success after degradation starts recovering")
        void successStartsRecovery() {
            degrade();

            Optional<DetectorTransition> t = succeed(T0.plusSeconds(30), 0.0);

            assertThat(t).isPresent();
            assertThat(t.get().to()).isEqualTo(DetectorPhase.RECOVERING);
            assertThat(tracker.consecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("recovery needs M consecutive successes")
        void recoveryNeedsM() {
            degrade();
            Instant at = T0.plusSeconds(30);
            for (int i = 0; i < 4; i++) {
                succeed(at, 0.0);
                at = at.plusSeconds(10);
            }
            assertThat(tracker.phase()).isEqualTo(DetectorPhase.RECOVERING);

            Optional<DetectorTransition> t = succeed(at, 0.0);

            assertThat(t).isPresent();
            assertThat(t.get().to()).isEqualTo(DetectorPhase.HEALTHY);
        }

        @Test
        @DisplayName("a failure while recovering degrades again and resets the count")
        void failureWhileRecovering() {
            degrade();
            succeed(T0.plusSeconds(30), 0.0);
            succeed(T0.plusSeconds(40), 0.0);

            Optional<DetectorTransition> t = fail(T0.plusSeconds(50));

            assertThat(t).isPresent();
            assertThat(t.get().to()).isEqualTo(DetectorPhase.DEGRADED);
            assertThat(tracker.consecutiveSuccesses()).isZero();
        }

        @Test
        @DisplayName("recovery waits until the burn rate is back under the suspect rate")
        void recoveryWaitsForBurn() {
            degrade();
            Instant at = T0.plusSeconds(30);
            for (int i = 0; i < 8; i++) {
                succeed(at, 3.0);
                at = at.plusSeconds(10);
            }
            assertThat(tracker.phase()).isEqualTo(DetectorPhase.RECOVERING);

            assertThat(succeed(at, 0.5)).map(DetectorTransition::to).contains(DetectorPhase.HEALTHY);
        }

        @Test
        @DisplayName("a suspected region clears after M successes")
        void suspicionClears() {
            fail(T0);
            Instant at = T0.plusSeconds(10);
            for (int i = 0; i < 5; i++) {
                succeed(at, 0.0);
                at = at.plusSeconds(10);
            }

            assertThat(tracker.phase()).isEqualTo(DetectorPhase.HEALTHY);
        }
    }
}
