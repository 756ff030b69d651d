package com.platform.failover.persistence;

import com.platform.failover.error.FailoverAlreadyInProgressException;
import com.platform.failover.model.FailoverEvent;
import com.platform.failover.persistence.entity.FailoverEventEntity;
import com.platform.failover.persistence.repository.FailoverEventJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Failover event store backed by Spring Data JPA.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "failover.persistence.mode", havingValue = "jpa", matchIfMissing = true)
public class JpaFailoverEventStore implements FailoverEventStore {
    
    private final FailoverEventJpaRepository repository;
    private final EntityMappers mappers;
    
    public JpaFailoverEventStore(FailoverEventJpaRepository repository, EntityMappers mappers) {
        this.repository = repository;
        this.mappers = mappers;
    }
    
    @Override
    @Transactional
    public synchronized FailoverEvent open(FailoverEvent event) {
        Optional<FailoverEventEntity> live = repository.findByLiveServiceId(event.getServiceId());
        if (live.isPresent()) {
            throw new FailoverAlreadyInProgressException(event.getServiceId(), live.get().getId());
        }
        try {
            repository.saveAndFlush(mappers.toEntity(event));
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent live failover detected for {}: {}", event.getServiceId(), e.getMessage());
            throw new FailoverAlreadyInProgressException(event.getServiceId(), "unknown");
        }
        log.info("Persisted new failover {} for {}", event.getId(), event.getServiceId());
        return event;
    }
    
    @Override
    @Transactional
    public synchronized void save(FailoverEvent event) {
        Optional<FailoverEventEntity> existing = repository.findById(event.getId());
        if (existing.isEmpty()) {
            repository.save(mappers.toEntity(event));
            return;
        }
        
        FailoverEventEntity entity = existing.get();
        if (entity.getPhase().isTerminal()) {
            throw new IllegalStateException(
                String.format("Failover %s is %s and cannot be modified", entity.getId(), entity.getPhase()));
        }
        mappers.applyState(event, entity);
        mappers.appendNewSteps(event, entity);
        repository.save(entity);
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<FailoverEvent> findById(String eventId) {
        return repository.findById(eventId).map(mappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<FailoverEvent> findLive(String serviceId) {
        return repository.findByLiveServiceId(serviceId).map(mappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<FailoverEvent> findByService(String serviceId) {
        return repository.findByServiceIdOrderByTriggeredAtDesc(serviceId).stream()
            .map(mappers::toDomain)
            .toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<FailoverEvent> findAllLive() {
        return repository.findByLiveServiceIdIsNotNull().stream()
            .map(mappers::toDomain)
            .toList();
    }
}
