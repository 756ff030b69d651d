package com.platform.failover.persistence;

import com.platform.failover.model.FailoverEvent;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of failover events and their step history.
 */
public interface FailoverEventStore {
    
    /**
     * Persist a newly opened event.
     * 
     * @throws com.platform.failover.error.FailoverAlreadyInProgressException if the service
     *         already has a live event
     */
    FailoverEvent open(FailoverEvent event);
    
    /**
     * Persist the current phase and history of an event. Terminal events are written once more
     * when they become terminal and are immutable afterwards.
     */
    void save(FailoverEvent event);
    
    Optional<FailoverEvent> findById(String eventId);
    
    Optional<FailoverEvent> findLive(String serviceId);
    
    /**
     * Events of a service, newest first.
     */
    List<FailoverEvent> findByService(String serviceId);
    
    List<FailoverEvent> findAllLive();
}
