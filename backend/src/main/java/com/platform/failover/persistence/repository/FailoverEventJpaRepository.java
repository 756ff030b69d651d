package com.platform.failover.persistence.repository;

import com.platform.failover.persistence.entity.FailoverEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for failover events.
 */
@Repository
public interface FailoverEventJpaRepository extends JpaRepository<FailoverEventEntity, String> {
    
    /**
     * The live event of a service, if any.
     */
    Optional<FailoverEventEntity> findByLiveServiceId(String serviceId);
    
    List<FailoverEventEntity> findByServiceIdOrderByTriggeredAtDesc(String serviceId);
    
    /**
     * All live events (for recovery).
     */
    List<FailoverEventEntity> findByLiveServiceIdIsNotNull();
}
