package com.platform.failover.coordinator;

import java.time.Instant;

/**
 * Point-in-time view of one service's coordinator, safe to hand to other threads.
 */
public record CoordinatorSnapshot(
    String serviceId,
    CoordinatorState state,
    String primary,
    String target,
    String liveEventId,
    Instant since,
    String reason
) {}
