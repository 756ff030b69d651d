package com.platform.failover.coordinator;

import com.platform.failover.observability.LoggingConfig;
import com.platform.failover.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single consumer thread of one service's bounded signal queue. Every detector and
 * coordinator decision for the service happens on this thread, in arrival order.
 * 
 * Completion signals that find the bounded queue full go to an unbounded overflow queue,
 * which the loop drains before taking anything else.
 */
@Slf4j
public class ServiceDecisionLoop implements Runnable {
    
    private static final long POLL_MS = 500;
    
    private final String serviceId;
    private final BlockingQueue<DecisionSignal> queue;
    private final ConcurrentLinkedQueue<DecisionSignal> completions = new ConcurrentLinkedQueue<>();
    private final Duration offerTimeout;
    private final MetricsRegistry metricsRegistry;
    private FailoverCoordinator coordinator;
    
    private volatile boolean running;
    private Thread thread;
    
    public ServiceDecisionLoop(String serviceId, int capacity, Duration offerTimeout, MetricsRegistry metricsRegistry) {
        this.serviceId = serviceId;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.offerTimeout = offerTimeout;
        this.metricsRegistry = metricsRegistry;
    }
    
    /**
     * Bind the coordinator. The coordinator needs this loop as its loopback, so it cannot
     * be a constructor argument.
     */
    void bind(FailoverCoordinator coordinator) {
        this.coordinator = coordinator;
    }
    
    /**
     * Enqueue a signal. Droppable signals never wait; completions are always accepted; others
     * wait up to the offer timeout.
     * 
     * @return false if the signal was dropped or timed out
     */
    public boolean submit(DecisionSignal signal) {
        if (signal.isCompletion()) {
            if (!queue.offer(signal)) {
                completions.add(signal);
                metricsRegistry.incrementCounter("failover.decision.overflow",
                    "service", serviceId, "signal", signal.signalType());
                log.warn("Decision queue of {} full, {} parked in overflow", serviceId, signal.signalType());
            }
            return true;
        }
        if (signal.isDroppable()) {
            boolean accepted = queue.offer(signal);
            if (!accepted) {
                metricsRegistry.recordDroppedSignal(serviceId, signal.signalType());
                log.debug("Decision queue of {} full, dropped {}", serviceId, signal.signalType());
            }
            return accepted;
        }
        
        try {
            boolean accepted = queue.offer(signal, offerTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!accepted && evictDroppable()) {
                accepted = queue.offer(signal);
            }
            if (!accepted) {
                metricsRegistry.recordDroppedSignal(serviceId, signal.signalType());
                log.error("Decision queue of {} full for {}ms, could not deliver {}",
                    serviceId, offerTimeout.toMillis(), signal.signalType());
            }
            return accepted;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
    
    /**
     * Make room for a control signal by discarding the oldest sample or tick.
     */
    private boolean evictDroppable() {
        for (DecisionSignal queued : queue) {
            if (queued.isDroppable() && queue.remove(queued)) {
                metricsRegistry.recordDroppedSignal(serviceId, queued.signalType());
                return true;
            }
        }
        return false;
    }
    
    public synchronized void start() {
        if (running) {
            return;
        }
        if (coordinator == null) {
            throw new IllegalStateException("No coordinator bound for " + serviceId);
        }
        running = true;
        thread = new Thread(this, "decision-" + serviceId);
        thread.setDaemon(true);
        thread.start();
        log.info("Decision loop started for {}", serviceId);
    }
    
    public synchronized void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
    }
    
    @Override
    public void run() {
        while (running) {
            DecisionSignal signal = completions.poll();
            if (signal != null) {
                process(signal);
                continue;
            }
            try {
                signal = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (signal != null) {
                process(signal);
            }
        }
        log.info("Decision loop stopped for {}", serviceId);
    }
    
    void process(DecisionSignal signal) {
        LoggingConfig.setDecisionContext(serviceId, null);
        long start = System.nanoTime();
        try {
            coordinator.handle(signal);
        } catch (RuntimeException e) {
            log.error("Decision for {} failed on {}: {}", serviceId, signal.signalType(), e.getMessage(), e);
            metricsRegistry.incrementCounter("failover.decision.errors", "service", serviceId);
        } finally {
            metricsRegistry.recordLatency("decision", signal.signalType(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            LoggingConfig.clearDecisionContext();
        }
    }
    
    public int queueDepth() {
        return queue.size() + completions.size();
    }
    
    public FailoverCoordinator coordinator() {
        return coordinator;
    }
}
