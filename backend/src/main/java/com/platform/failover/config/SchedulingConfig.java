package com.platform.failover.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Clock and thread pools shared by probes, decision loops and failover workers.
 */
@Configuration
public class SchedulingConfig {
    
    public static final String PROBE_SCHEDULER = "probeScheduler";
    public static final String FAILOVER_WORKERS = "failoverWorkers";
    public static final String STEP_RUNNER = "stepRunner";
    public static final String NOTIFICATION_SENDER = "notificationSender";
    
    private static final int NOTIFICATION_QUEUE_CAPACITY = 10_000;
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean(name = PROBE_SCHEDULER, destroyMethod = "shutdownNow")
    public ScheduledExecutorService probeScheduler(FleetProperties properties) {
        return Executors.newScheduledThreadPool(
            properties.getDecision().getProbeThreads(), namedThreads("probe"));
    }
    
    @Bean(name = FAILOVER_WORKERS, destroyMethod = "shutdownNow")
    public ExecutorService failoverWorkers(FleetProperties properties) {
        return Executors.newFixedThreadPool(
            properties.getDecision().getWorkerThreads(), namedThreads("failover-worker"));
    }
    
    /**
     * Runs individual step attempts so that the calling worker can enforce the step timeout.
     */
    @Bean(name = STEP_RUNNER, destroyMethod = "shutdownNow")
    public ExecutorService stepRunner() {
        return Executors.newCachedThreadPool(namedThreads("failover-step"));
    }
    
    /**
     * Single thread so notifications leave in the order they were published. A full queue
     * rejects, which the notifier treats as an unavailable sink.
     */
    @Bean(name = NOTIFICATION_SENDER, destroyMethod = "shutdownNow")
    public ExecutorService notificationSender() {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(NOTIFICATION_QUEUE_CAPACITY), namedThreads("notifier"),
            new ThreadPoolExecutor.AbortPolicy());
    }
    
    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
