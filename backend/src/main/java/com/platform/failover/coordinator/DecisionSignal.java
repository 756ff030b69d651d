package com.platform.failover.coordinator;

import com.platform.failover.executor.ExecutionResult;
import com.platform.failover.model.FailoverEvent;
import com.platform.failover.model.ProbeSample;

import java.time.Instant;

/**
 * Input to a service's decision loop. Signals are handled one at a time in arrival order.
 */
public sealed interface DecisionSignal permits DecisionSignal.Sample, DecisionSignal.Tick,
        DecisionSignal.ExecutionFinished, DecisionSignal.VerificationFinished, DecisionSignal.RollbackFinished,
        DecisionSignal.Resume, OverrideSignal {
    
    String serviceId();
    
    /**
     * Whether the signal may be dropped when the queue is full. Dropped samples and ticks
     * are replaced by the next ones; anything else must be delivered.
     */
    default boolean isDroppable() {
        return false;
    }
    
    /**
     * Whether the signal reports the end of work handed to a worker. Losing one would leave
     * the coordinator waiting forever, so completions are never dropped.
     */
    default boolean isCompletion() {
        return false;
    }
    
    default String signalType() {
        return getClass().getSimpleName();
    }
    
    record Sample(ProbeSample sample) implements DecisionSignal {
        @Override
        public String serviceId() {
            return sample.serviceId();
        }
        
        @Override
        public boolean isDroppable() {
            return true;
        }
    }
    
    record Tick(String serviceId, Instant at) implements DecisionSignal {
        @Override
        public boolean isDroppable() {
            return true;
        }
    }
    
    record ExecutionFinished(String serviceId, String eventId, ExecutionResult result) implements DecisionSignal {
        @Override
        public boolean isCompletion() {
            return true;
        }
    }
    
    record VerificationFinished(String serviceId, String eventId, boolean passed, String detail)
            implements DecisionSignal {
        @Override
        public boolean isCompletion() {
            return true;
        }
    }
    
    record RollbackFinished(String serviceId, String eventId, boolean succeeded, String detail)
            implements DecisionSignal {
        @Override
        public boolean isCompletion() {
            return true;
        }
    }
    
    /**
     * Hand a live event found at startup back to its coordinator.
     */
    record Resume(String serviceId, FailoverEvent event) implements DecisionSignal {}
}
