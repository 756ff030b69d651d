package com.platform.failover.persistence;

import com.platform.failover.error.FailoverAlreadyInProgressException;
import com.platform.failover.model.FailoverEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local event store for running without a database. Nothing survives a restart.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "failover.persistence.mode", havingValue = "memory")
public class InMemoryFailoverEventStore implements FailoverEventStore {
    
    private final Map<String, FailoverEvent> events = new LinkedHashMap<>();
    
    @Override
    public synchronized FailoverEvent open(FailoverEvent event) {
        Optional<FailoverEvent> live = findLive(event.getServiceId());
        if (live.isPresent()) {
            throw new FailoverAlreadyInProgressException(event.getServiceId(), live.get().getId());
        }
        events.put(event.getId(), event);
        log.debug("Opened {}", event);
        return event;
    }
    
    @Override
    public synchronized void save(FailoverEvent event) {
        events.put(event.getId(), event);
    }
    
    @Override
    public synchronized Optional<FailoverEvent> findById(String eventId) {
        return Optional.ofNullable(events.get(eventId));
    }
    
    @Override
    public synchronized Optional<FailoverEvent> findLive(String serviceId) {
        return events.values().stream()
            .filter(e -> e.getServiceId().equals(serviceId))
            .filter(FailoverEvent::isLive)
            .findFirst();
    }
    
    @Override
    public synchronized List<FailoverEvent> findByService(String serviceId) {
        List<FailoverEvent> result = new ArrayList<>();
        for (FailoverEvent event : events.values()) {
            if (event.getServiceId().equals(serviceId)) {
                result.add(event);
            }
        }
        result.sort(Comparator.comparing(FailoverEvent::getTriggeredAt).reversed());
        return result;
    }
    
    @Override
    public synchronized List<FailoverEvent> findAllLive() {
        return events.values().stream().filter(FailoverEvent::isLive).toList();
    }
}
