package com.platform.failover.connectors;

/**
 * Promotes a region's database to primary for a service.
 */
public interface DatabasePromotionApi {
    
    /**
     * Idempotent: promoting the current primary reports {@link PromotionResult#ALREADY_PRIMARY}.
     */
    PromotionResult promote(String serviceId, String regionId);
    
    /**
     * Return a promoted region to replica, used when a failover is rolled back.
     */
    void demote(String serviceId, String regionId);
}
