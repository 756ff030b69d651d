package com.platform.failover.support;

import com.platform.failover.model.AvailabilityEvent;
import com.platform.failover.notify.Notifier;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Notifier that keeps every published event in memory.
 */
public class RecordingNotifier implements Notifier {
    
    private final List<AvailabilityEvent> events = new CopyOnWriteArrayList<>();
    
    @Override
    public CompletableFuture<Void> publish(AvailabilityEvent event) {
        events.add(event);
        return CompletableFuture.completedFuture(null);
    }
    
    public List<AvailabilityEvent> events() {
        return List.copyOf(events);
    }
    
    public List<AvailabilityEvent> ofType(AvailabilityEvent.EventType type) {
        return events.stream().filter(e -> e.eventType() == type).toList();
    }
    
    public long count(AvailabilityEvent.EventType type) {
        return events.stream().filter(e -> e.eventType() == type).count();
    }
    
    public void clear() {
        events.clear();
    }
}
