package com.platform.failover.notify;

import com.platform.failover.config.SchedulingConfig;
import com.platform.failover.model.AvailabilityEvent;
import com.platform.failover.observability.MetricsRegistry;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Publishes availability events to Kafka, keyed by service id.
 * 
 * Sends are handed to the notification sender thread, so a broker that cannot be reached
 * never holds up the caller; the returned future completes once Kafka acknowledges.
 * While the circuit breaker is open events are held in memory and flushed on a schedule.
 * The backlog is bounded; the oldest events are dropped first.
 */
@Slf4j
@Component
public class KafkaEventNotifier implements Notifier {
    
    static final int MAX_BACKLOG = 10_000;
    private static final long FLUSH_SEND_TIMEOUT_SECONDS = 10;
    
    private final KafkaTemplate<String, AvailabilityEvent> kafkaTemplate;
    private final MetricsRegistry metricsRegistry;
    private final String eventTopic;
    private final Executor sender;
    private final ConcurrentLinkedQueue<AvailabilityEvent> backlog = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean available = new AtomicBoolean(true);
    
    public KafkaEventNotifier(KafkaTemplate<String, AvailabilityEvent> kafkaTemplate,
                              MetricsRegistry metricsRegistry,
                              @Value("${failover.kafka.event-topic:failover-events}") String eventTopic,
                              @Qualifier(SchedulingConfig.NOTIFICATION_SENDER) Executor sender) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsRegistry = metricsRegistry;
        this.eventTopic = eventTopic;
        this.sender = sender;
    }
    
    @Override
    @CircuitBreaker(name = "notifier", fallbackMethod = "queueEvent")
    public CompletableFuture<Void> publish(AvailabilityEvent event) {
        log.debug("Publishing {} for {}/{}", event.eventType(), event.serviceId(), event.regionId());
        long startTime = System.currentTimeMillis();
        
        return CompletableFuture.supplyAsync(() -> kafkaTemplate.send(eventTopic, event.serviceId(), event), sender)
            .thenCompose(Function.identity())
            .thenAccept(result -> {
                metricsRegistry.recordLatency("notifier", "publish", System.currentTimeMillis() - startTime);
                metricsRegistry.incrementCounter("failover.notifier.published", "type", event.eventType().name());
                available.set(true);
            });
    }
    
    @SuppressWarnings("unused")
    private CompletableFuture<Void> queueEvent(AvailabilityEvent event, Throwable t) {
        log.warn("Notification sink unavailable ({}), queuing {} event {}",
            t.getMessage(), event.eventType(), event.eventId());
        enqueue(event);
        available.set(false);
        return CompletableFuture.completedFuture(null);
    }
    
    void enqueue(AvailabilityEvent event) {
        backlog.offer(event);
        metricsRegistry.incrementCounter("failover.notifier.queued");
        while (backlog.size() > MAX_BACKLOG) {
            AvailabilityEvent dropped = backlog.poll();
            if (dropped != null) {
                metricsRegistry.incrementCounter("failover.notifier.dropped");
                log.warn("Notification backlog full, dropped {} event {}", dropped.eventType(), dropped.eventId());
            }
        }
    }
    
    /**
     * Retry queued events directly against the template. Stops at the first failure and keeps
     * the rest for the next run.
     */
    @Scheduled(fixedDelayString = "${failover.kafka.flush-interval-ms:15000}")
    public void flushBacklog() {
        if (backlog.isEmpty()) {
            return;
        }
        log.info("Flushing {} queued notifications", backlog.size());
        
        AvailabilityEvent event;
        while ((event = backlog.peek()) != null) {
            try {
                kafkaTemplate.send(eventTopic, event.serviceId(), event).get(FLUSH_SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                backlog.poll();
                metricsRegistry.incrementCounter("failover.notifier.published", "type", event.eventType().name());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                log.warn("Flush of queued notification {} failed, will retry: {}", event.eventId(), e.getMessage());
                available.set(false);
                return;
            }
        }
        available.set(true);
    }
    
    public int getQueuedEventCount() {
        return backlog.size();
    }
    
    public boolean isAvailable() {
        return available.get();
    }
}
