package com.platform.failover.model;

/**
 * Role a region plays for a service.
 */
public enum RegionRole {
    PRIMARY,
    STANDBY,
    /**
     * Not running warm; never selected automatically as a failover target.
     */
    COLD
}
