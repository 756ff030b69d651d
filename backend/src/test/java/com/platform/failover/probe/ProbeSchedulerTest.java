package com.platform.failover.probe;

import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.RegionDefinition;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.observability.MetricsRegistry;
import com.platform.failover.support.TestFleets;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ProbeScheduler}.
 */
@ExtendWith(MockitoExtension.class)
class ProbeSchedulerTest {

    @Mock
    private HealthProbeRegistry probeRegistry;

    @Mock
    private ScheduledExecutorService executor;

    private final List<ProbeSample> received = new CopyOnWriteArrayList<>();
    private SimpleMeterRegistry meterRegistry;
    private ProbeScheduler scheduler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new ProbeScheduler(TestFleets.fleetOf(TestFleets.checkout()), probeRegistry, received::add,
            executor, new MetricsRegistry(meterRegistry));
    }

    private ProbeScheduler.ProbeTask firstTask() {
        return scheduler.tasks().get(0);
    }

    @Test
    @DisplayName("creates one task per service and region pair")
    void oneTaskPerPair() {
        assertThat(scheduler.tasks()).extracting(ProbeScheduler.ProbeTask::pair)
            .containsExactly("checkout/us-east", "checkout/us-west");
    }

    @Test
    @DisplayName("schedules every pair at its probe interval")
    void schedulesAtInterval() {
        scheduler.start();

        verify(executor, times(2)).scheduleAtFixedRate(any(Runnable.class), eq(0L), eq(10_000L),
            eq(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("skips a tick while the previous probe of the pair is in flight")
    void suppressesOverlappingProbe() {
        ProbeScheduler.ProbeTask task = firstTask();

        task.tick();
        task.tick();

        verify(executor, times(1)).execute(any(Runnable.class));
        assertThat(task.isInFlight()).isTrue();
        assertThat(meterRegistry.find("failover.probe.suppressed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("a finished probe delivers its sample and frees the pair")
    void deliversSample() {
        ProbeSample sample = ProbeSample.success("checkout", "us-east", Instant.parse("2024-03-01T12:00:00Z"),
            Duration.ofMillis(12));
        when(probeRegistry.probe(any(ServiceDefinition.class), any(RegionDefinition.class))).thenReturn(sample);
        ProbeScheduler.ProbeTask task = firstTask();

        task.tick();
        ArgumentCaptor<Runnable> dispatched = ArgumentCaptor.forClass(Runnable.class);
        verify(executor).execute(dispatched.capture());
        dispatched.getValue().run();

        assertThat(received).containsExactly(sample);
        assertThat(task.isInFlight()).isFalse();
    }

    @Test
    @DisplayName("a rejected dispatch does not leave the pair stuck in flight")
    void rejectedDispatch() {
        doThrow(new RejectedExecutionException("shutting down"))
            .when(executor).execute(any(Runnable.class));
        ProbeScheduler.ProbeTask task = firstTask();

        task.tick();

        assertThat(task.isInFlight()).isFalse();
        verify(executor, times(1)).execute(any(Runnable.class));
    }

    @Test
    @DisplayName("stop cancels the scheduled tasks")
    @SuppressWarnings({"unchecked", "rawtypes"})
    void stopCancels() {
        ScheduledFuture future = mock(ScheduledFuture.class);
        when(executor.scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class)))
            .thenReturn(future);
        scheduler.start();

        scheduler.stop();

        verify(future, times(2)).cancel(false);
    }
}
