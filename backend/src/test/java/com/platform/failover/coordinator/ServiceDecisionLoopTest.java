package com.platform.failover.coordinator;

import com.platform.failover.model.ProbeSample;
import com.platform.failover.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;

/**
 * Unit tests for {@link ServiceDecisionLoop}.
 */
@ExtendWith(MockitoExtension.class)
class ServiceDecisionLoopTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private FailoverCoordinator coordinator;

    private SimpleMeterRegistry meterRegistry;
    private ServiceDecisionLoop loop;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        loop = new ServiceDecisionLoop("checkout", 2, Duration.ofMillis(10), new MetricsRegistry(meterRegistry));
        loop.bind(coordinator);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    private DecisionSignal sample() {
        return new DecisionSignal.Sample(ProbeSample.success("checkout", "us-east", T0, Duration.ofMillis(5)));
    }

    private OverrideSignal abort() {
        return new OverrideSignal(OverrideType.ABORT, "checkout", null, "alice", "drill", "token");
    }

    private double dropped(String signal) {
        return meterRegistry.find("failover.decision.dropped").tag("signal", signal).counter().count();
    }

    @Test
    @DisplayName("drops samples when the queue is full")
    void dropsSamplesWhenFull() {
        assertThat(loop.submit(sample())).isTrue();
        assertThat(loop.submit(sample())).isTrue();
        assertThat(loop.submit(sample())).isFalse();

        assertThat(loop.queueDepth()).isEqualTo(2);
        assertThat(dropped("Sample")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("control signals evict the oldest sample instead of being dropped")
    void controlSignalEvictsSample() {
        loop.submit(sample());
        loop.submit(new DecisionSignal.Tick("checkout", T0));

        assertThat(loop.submit(abort())).isTrue();

        assertThat(loop.queueDepth()).isEqualTo(2);
        assertThat(dropped("Sample")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("control signal is refused only when the queue holds nothing droppable")
    void controlSignalRefused() {
        loop.submit(abort());
        loop.submit(abort());

        assertThat(loop.submit(abort())).isFalse();
        assertThat(dropped("OverrideSignal")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("completion signals are never refused, even behind a queue full of overrides")
    void completionNeverDropped() {
        List<DecisionSignal> handled = new CopyOnWriteArrayList<>();
        doAnswer(inv -> handled.add(inv.getArgument(0))).when(coordinator).handle(any());
        loop.submit(abort());
        loop.submit(abort());
        DecisionSignal finished = new DecisionSignal.RollbackFinished("checkout", "evt-1", true, "compensated");

        assertThat(loop.submit(finished)).isTrue();
        assertThat(loop.queueDepth()).isEqualTo(3);
        assertThat(meterRegistry.find("failover.decision.overflow").tag("signal", "RollbackFinished").counter()
            .count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("failover.decision.dropped").counter()).isNull();

        loop.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> handled.size() == 3);
        assertThat(handled.get(0)).isEqualTo(finished);
    }

    @Test
    @DisplayName("handles signals in arrival order on its own thread")
    void processesInOrder() {
        List<DecisionSignal> handled = new CopyOnWriteArrayList<>();
        doAnswer(inv -> handled.add(inv.getArgument(0))).when(coordinator).handle(any());
        DecisionSignal first = sample();
        DecisionSignal second = abort();

        loop.start();
        loop.submit(first);
        loop.submit(second);

        await().atMost(Duration.ofSeconds(5)).until(() -> handled.size() == 2);
        assertThat(handled).containsExactly(first, second);
    }

    @Test
    @DisplayName("a failing decision is counted and does not stop the loop")
    void survivesFailures() {
        doThrow(new IllegalStateException("boom")).when(coordinator).handle(any());

        loop.process(sample());

        assertThat(meterRegistry.find("failover.decision.errors").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("refuses to start without a coordinator")
    void requiresCoordinator() {
        ServiceDecisionLoop unbound = new ServiceDecisionLoop("payments", 4, Duration.ofMillis(10),
            new MetricsRegistry(new SimpleMeterRegistry()));

        assertThatThrownBy(unbound::start).isInstanceOf(IllegalStateException.class);
    }
}
