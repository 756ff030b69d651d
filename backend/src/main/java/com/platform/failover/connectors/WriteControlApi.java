package com.platform.failover.connectors;

/**
 * Stops and resumes writes of a service in one region. Both calls are idempotent.
 */
public interface WriteControlApi {
    
    void quiesceWrites(String serviceId, String regionId);
    
    void resumeWrites(String serviceId, String regionId);
}
