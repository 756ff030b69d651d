package com.platform.failover.persistence;

import com.platform.failover.model.FailoverEvent;
import com.platform.failover.model.StepRecord;
import com.platform.failover.persistence.entity.FailoverEventEntity;
import com.platform.failover.persistence.entity.FailoverStepEntity;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapping between failover domain objects and JPA entities.
 */
@Component
public class EntityMappers {
    
    public FailoverEventEntity toEntity(FailoverEvent domain) {
        FailoverEventEntity entity = FailoverEventEntity.builder()
            .id(domain.getId())
            .serviceId(domain.getServiceId())
            .fromRegion(domain.getFromRegion())
            .toRegion(domain.getToRegion())
            .triggeredAt(domain.getTriggeredAt())
            .trigger(domain.getTrigger())
            .triggeredBy(domain.getTriggeredBy())
            .build();
        applyState(domain, entity);
        appendNewSteps(domain, entity);
        return entity;
    }
    
    /**
     * Copy mutable state (phase, end, reason, live marker) from the domain object.
     */
    public void applyState(FailoverEvent domain, FailoverEventEntity entity) {
        entity.setPhase(domain.getPhase());
        entity.setFinishedAt(domain.getFinishedAt());
        entity.setReason(domain.getReason());
        entity.setLiveServiceId(domain.isLive() ? domain.getServiceId() : null);
    }
    
    /**
     * Append history records the entity does not have yet. History is append-only, so
     * the entity's step count is the index of the first new record.
     */
    public void appendNewSteps(FailoverEvent domain, FailoverEventEntity entity) {
        List<StepRecord> history = domain.getHistory();
        for (int i = entity.getSteps().size(); i < history.size(); i++) {
            entity.addStep(toEntity(history.get(i), i));
        }
    }
    
    public FailoverStepEntity toEntity(StepRecord record, int sequence) {
        return FailoverStepEntity.builder()
            .sequence(sequence)
            .stepName(record.stepName())
            .attempt(record.attempt())
            .outcome(record.outcome())
            .startedAt(record.startedAt())
            .finishedAt(record.finishedAt())
            .detail(record.detail())
            .build();
    }
    
    public FailoverEvent toDomain(FailoverEventEntity entity) {
        List<StepRecord> history = entity.getSteps().stream()
            .map(s -> new StepRecord(s.getStepName(), s.getAttempt(), s.getOutcome(),
                s.getStartedAt(), s.getFinishedAt(), s.getDetail()))
            .toList();
        
        return new FailoverEvent(
            entity.getId(),
            entity.getServiceId(),
            entity.getFromRegion(),
            entity.getToRegion(),
            entity.getTriggeredAt(),
            entity.getTrigger(),
            entity.getTriggeredBy(),
            entity.getPhase(),
            history,
            entity.getFinishedAt(),
            entity.getReason()
        );
    }
}
