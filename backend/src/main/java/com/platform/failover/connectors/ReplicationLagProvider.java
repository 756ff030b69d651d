package com.platform.failover.connectors;

import java.time.Duration;

public interface ReplicationLagProvider {
    
    /**
     * Current replication lag of a region behind the primary.
     * 
     * @throws com.platform.failover.error.InfrastructureApiException if the lag cannot be read
     */
    Duration replicationLag(String serviceId, String regionId);
}
