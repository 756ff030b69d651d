package com.platform.failover.notify;

import com.platform.failover.model.AvailabilityEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Sink for alerting and audit events. Fire-and-forget: callers never wait on the result
 * and a failed delivery never affects a decision.
 */
public interface Notifier {
    
    CompletableFuture<Void> publish(AvailabilityEvent event);
}
