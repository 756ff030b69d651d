package com.platform.failover.model;

import java.time.Instant;

/**
 * One recorded attempt of a failover step (or of its compensation).
 */
public record StepRecord(
    String stepName,
    int attempt,
    StepOutcome outcome,
    Instant startedAt,
    Instant finishedAt,
    String detail
) {}
