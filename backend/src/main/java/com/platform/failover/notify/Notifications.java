package com.platform.failover.notify;

import com.platform.failover.model.AvailabilityEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishing helpers for decision code, which must never fail because of the sink.
 */
@Slf4j
public final class Notifications {
    
    private Notifications() {
    }
    
    public static void publishQuietly(Notifier notifier, AvailabilityEvent event) {
        try {
            notifier.publish(event).exceptionally(ex -> {
                log.warn("Notification {} for {} failed: {}", event.eventType(), event.serviceId(), ex.getMessage());
                return null;
            });
        } catch (RuntimeException e) {
            log.warn("Notification {} for {} failed: {}", event.eventType(), event.serviceId(), e.getMessage());
        }
    }
}
