package com.platform.failover.slo;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding time window of good/bad events. Not thread-safe; guarded by the owning tracker.
 */
class SampleWindow {
    
    private record Event(Instant at, boolean good) {}
    
    private final String name;
    private final Duration length;
    private final Deque<Event> events = new ArrayDeque<>();
    private long badEvents;
    
    SampleWindow(String name, Duration length) {
        this.name = name;
        this.length = length;
    }
    
    void append(Instant at, boolean good, Instant now) {
        events.addLast(new Event(at, good));
        if (!good) {
            badEvents++;
        }
        evict(now);
    }
    
    /**
     * Drop events that fell out of {@code (now - length, now]}.
     */
    void evict(Instant now) {
        Instant cutoff = now.minus(length);
        while (!events.isEmpty() && !events.peekFirst().at().isAfter(cutoff)) {
            if (!events.pollFirst().good()) {
                badEvents--;
            }
        }
    }
    
    long total() {
        return events.size();
    }
    
    long bad() {
        return badEvents;
    }
    
    /**
     * Good over total; an empty window is fully compliant.
     */
    double compliance() {
        if (events.isEmpty()) {
            return 1.0;
        }
        return (double) (events.size() - badEvents) / events.size();
    }
    
    String name() {
        return name;
    }
    
    Duration length() {
        return length;
    }
}
