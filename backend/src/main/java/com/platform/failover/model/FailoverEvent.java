package com.platform.failover.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One failover of a service from one region to another, with the history of every
 * executed step attempt.
 * 
 * The history is appended before the executor proceeds to the next action, so a
 * crash mid-sequence leaves a resumable record. Once the phase is terminal the
 * event no longer accepts changes.
 */
public class FailoverEvent {
    
    private final String id;
    private final String serviceId;
    private final String fromRegion;
    private final String toRegion;
    private final Instant triggeredAt;
    private final FailoverTrigger trigger;
    private final String triggeredBy;
    private final List<StepRecord> history;
    
    private FailoverPhase phase;
    private Instant finishedAt;
    private String reason;
    
    public FailoverEvent(
            String id,
            String serviceId,
            String fromRegion,
            String toRegion,
            Instant triggeredAt,
            FailoverTrigger trigger,
            String triggeredBy,
            FailoverPhase phase,
            List<StepRecord> history,
            Instant finishedAt,
            String reason) {
        this.id = id;
        this.serviceId = serviceId;
        this.fromRegion = fromRegion;
        this.toRegion = toRegion;
        this.triggeredAt = triggeredAt;
        this.trigger = trigger;
        this.triggeredBy = triggeredBy;
        this.phase = phase;
        this.history = new ArrayList<>(history);
        this.finishedAt = finishedAt;
        this.reason = reason;
    }
    
    public static FailoverEvent open(String serviceId, String fromRegion, String toRegion,
                                     FailoverTrigger trigger, String triggeredBy, Instant now) {
        return new FailoverEvent(
            UUID.randomUUID().toString(),
            serviceId,
            fromRegion,
            toRegion,
            now,
            trigger,
            triggeredBy,
            FailoverPhase.EXECUTING,
            List.of(),
            null,
            null
        );
    }
    
    public synchronized void record(StepRecord record) {
        requireLive("record step " + record.stepName());
        history.add(record);
    }
    
    public synchronized void moveTo(FailoverPhase newPhase, Instant at, String why) {
        requireLive("move to " + newPhase);
        this.phase = newPhase;
        this.reason = why;
        if (newPhase.isTerminal()) {
            this.finishedAt = at;
        }
    }
    
    /**
     * A copy of this event in {@code newPhase}, for callers that persist a change before
     * adopting it. This event is left as it is.
     */
    public synchronized FailoverEvent withPhase(FailoverPhase newPhase, Instant at, String why) {
        requireLive("move to " + newPhase);
        return new FailoverEvent(id, serviceId, fromRegion, toRegion, triggeredAt, trigger, triggeredBy,
            newPhase, history, newPhase.isTerminal() ? at : finishedAt, why);
    }
    
    /**
     * Latest recorded outcome for a step, compensation included.
     */
    public synchronized Optional<StepOutcome> latestOutcome(String stepName) {
        for (int i = history.size() - 1; i >= 0; i--) {
            StepRecord record = history.get(i);
            if (record.stepName().equals(stepName)) {
                return Optional.of(record.outcome());
            }
        }
        return Optional.empty();
    }
    
    public boolean hasSucceeded(String stepName) {
        return latestOutcome(stepName).map(o -> o == StepOutcome.SUCCEEDED).orElse(false);
    }
    
    public synchronized int attemptsOf(String stepName) {
        return (int) history.stream()
            .filter(r -> r.stepName().equals(stepName))
            .count();
    }
    
    private void requireLive(String action) {
        if (phase.isTerminal()) {
            throw new IllegalStateException(
                String.format("Failover %s is %s and cannot %s", id, phase, action));
        }
    }
    
    public String getId() {
        return id;
    }
    
    public String getServiceId() {
        return serviceId;
    }
    
    public String getFromRegion() {
        return fromRegion;
    }
    
    public String getToRegion() {
        return toRegion;
    }
    
    public Instant getTriggeredAt() {
        return triggeredAt;
    }
    
    public FailoverTrigger getTrigger() {
        return trigger;
    }
    
    public String getTriggeredBy() {
        return triggeredBy;
    }
    
    public synchronized FailoverPhase getPhase() {
        return phase;
    }
    
    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }
    
    public synchronized String getReason() {
        return reason;
    }
    
    public synchronized List<StepRecord> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }
    
    public boolean isLive() {
        return !getPhase().isTerminal();
    }
    
    @Override
    public String toString() {
        return String.format("FailoverEvent[%s %s: %s -> %s, %s]", id, serviceId, fromRegion, toRegion, getPhase());
    }
}
