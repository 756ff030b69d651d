package com.platform.failover.connectors;

/**
 * DNS or traffic-manager routing. {@code route} is idempotent.
 */
public interface TrafficRoutingApi {
    
    void route(String serviceId, String regionId);
}
