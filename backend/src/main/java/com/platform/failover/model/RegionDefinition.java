package com.platform.failover.model;

/**
 * A candidate region of a service, as configured.
 */
public record RegionDefinition(
    String regionId,
    RegionRole role,
    HealthEndpoint healthEndpoint
) {}
