package com.platform.failover.config;

import com.platform.failover.error.ResourceNotFoundException;
import com.platform.failover.model.ServiceDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, immutable set of services under control.
 */
public final class Fleet {
    
    private final Map<String, ServiceDefinition> services;
    
    public Fleet(List<ServiceDefinition> services) {
        Map<String, ServiceDefinition> byId = new LinkedHashMap<>();
        services.forEach(s -> byId.put(s.serviceId(), s));
        this.services = Collections.unmodifiableMap(byId);
    }
    
    public Collection<ServiceDefinition> services() {
        return services.values();
    }
    
    public ServiceDefinition service(String serviceId) {
        ServiceDefinition definition = services.get(serviceId);
        if (definition == null) {
            throw ResourceNotFoundException.service(serviceId);
        }
        return definition;
    }
    
    public boolean contains(String serviceId) {
        return services.containsKey(serviceId);
    }
    
    public int regionCount() {
        return services.values().stream().mapToInt(s -> s.regions().size()).sum();
    }
}
