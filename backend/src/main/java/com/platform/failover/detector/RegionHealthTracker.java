package com.platform.failover.detector;

import com.platform.failover.model.FailoverThresholds;
import com.platform.failover.model.ProbeSample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Hysteresis state of one (service, region) pair.
 * 
 * Degradation needs N failures within the failure interval; recovery needs M consecutive
 * successes with M greater than N. Owned by one decision loop, so not thread-safe.
 */
public class RegionHealthTracker {
    
    private final String serviceId;
    private final String regionId;
    private final FailoverThresholds thresholds;
    private final Duration unreachableAfter;
    
    private DetectorPhase phase = DetectorPhase.HEALTHY;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private final Deque<Instant> failureStreak = new ArrayDeque<>();
    private Instant failingSince;
    private Instant hardBurnSince;
    
    public RegionHealthTracker(String serviceId, String regionId, FailoverThresholds thresholds, Duration rto) {
        this.serviceId = serviceId;
        this.regionId = regionId;
        this.thresholds = thresholds;
        this.unreachableAfter = rto.dividedBy(2);
    }
    
    /**
     * Fold one sample and the current short-window burn rate into the tracker.
     * 
     * @return the phase change, if any
     */
    public Optional<DetectorTransition> observe(ProbeSample sample, double shortBurnRate) {
        Instant at = sample.timestamp();
        trackHardBurn(at, shortBurnRate);
        
        DetectorPhase next;
        String reason;
        if (sample.isSuccess()) {
            next = onSuccess(shortBurnRate);
            reason = next == DetectorPhase.HEALTHY
                ? consecutiveSuccesses + " consecutive successes"
                : "probe succeeded";
        } else {
            next = onFailure(at);
            reason = describeFailure(sample, next);
        }
        
        if (next == phase && phase == DetectorPhase.HEALTHY && shortBurnRate > thresholds.suspectBurnRate()) {
            next = DetectorPhase.SUSPECTED_DEGRADED;
            reason = String.format("short-window burn rate %.2f above %.2f", shortBurnRate, thresholds.suspectBurnRate());
        }
        if (next == DetectorPhase.DEGRADED && hardBurnSustained(at)) {
            next = DetectorPhase.UNREACHABLE;
            reason = String.format("burn rate %.2f above %.2f for %s", shortBurnRate, thresholds.hardBurnRate(),
                thresholds.shortWindow());
        }
        
        if (next == phase) {
            return Optional.empty();
        }
        DetectorTransition transition = new DetectorTransition(serviceId, regionId, phase, next, at, reason);
        phase = next;
        if (next == DetectorPhase.HEALTHY) {
            consecutiveSuccesses = 0;
        }
        return Optional.of(transition);
    }
    
    private DetectorPhase onFailure(Instant at) {
        consecutiveSuccesses = 0;
        consecutiveFailures++;
        if (failingSince == null) {
            failingSince = at;
        }
        failureStreak.addLast(at);
        Instant cutoff = at.minus(thresholds.failureInterval());
        while (!failureStreak.isEmpty() && failureStreak.peekFirst().isBefore(cutoff)) {
            failureStreak.pollFirst();
        }
        
        return switch (phase) {
            case HEALTHY -> DetectorPhase.SUSPECTED_DEGRADED;
            case SUSPECTED_DEGRADED -> failureStreak.size() >= thresholds.failuresToDegrade()
                ? DetectorPhase.DEGRADED
                : DetectorPhase.SUSPECTED_DEGRADED;
            case RECOVERING -> DetectorPhase.DEGRADED;
            case DEGRADED -> !failingSince.plus(unreachableAfter).isAfter(at)
                ? DetectorPhase.UNREACHABLE
                : DetectorPhase.DEGRADED;
            case UNREACHABLE -> DetectorPhase.UNREACHABLE;
        };
    }
    
    private DetectorPhase onSuccess(double shortBurnRate) {
        consecutiveFailures = 0;
        failureStreak.clear();
        failingSince = null;
        consecutiveSuccesses++;
        
        boolean recovered = consecutiveSuccesses >= thresholds.successesToRecover()
            && shortBurnRate <= thresholds.suspectBurnRate();
        
        return switch (phase) {
            case DEGRADED, UNREACHABLE -> DetectorPhase.RECOVERING;
            case RECOVERING, SUSPECTED_DEGRADED -> recovered ? DetectorPhase.HEALTHY : phase;
            case HEALTHY -> DetectorPhase.HEALTHY;
        };
    }
    
    private void trackHardBurn(Instant at, double shortBurnRate) {
        if (shortBurnRate > thresholds.hardBurnRate()) {
            if (hardBurnSince == null) {
                hardBurnSince = at;
            }
        } else {
            hardBurnSince = null;
        }
    }
    
    private boolean hardBurnSustained(Instant at) {
        return hardBurnSince != null && !hardBurnSince.plus(thresholds.shortWindow()).isAfter(at);
    }
    
    private String describeFailure(ProbeSample sample, DetectorPhase next) {
        String what = sample.outcome().name().toLowerCase();
        if (next == DetectorPhase.DEGRADED && phase == DetectorPhase.SUSPECTED_DEGRADED) {
            return failureStreak.size() + " consecutive failures within " + thresholds.failureInterval();
        }
        if (next == DetectorPhase.UNREACHABLE && phase == DetectorPhase.DEGRADED) {
            return "all probes failing since " + failingSince;
        }
        return "probe " + what + (sample.detail() != null ? ": " + sample.detail() : "");
    }
    
    public DetectorPhase phase() {
        return phase;
    }
    
    public int consecutiveFailures() {
        return consecutiveFailures;
    }
    
    public int consecutiveSuccesses() {
        return consecutiveSuccesses;
    }
    
    public String regionId() {
        return regionId;
    }
}
