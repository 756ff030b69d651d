package com.platform.failover.model;

/**
 * Where and how to check one region's health for a service.
 */
public record HealthEndpoint(
    ProbeType type,
    String url,
    String host,
    int port,
    int expectedStatus,
    String expectedContent
) {
    
    public static HealthEndpoint http(String url) {
        return new HealthEndpoint(ProbeType.HTTP, url, null, 0, 200, null);
    }
    
    public static HealthEndpoint tcp(String host, int port) {
        return new HealthEndpoint(ProbeType.TCP, null, host, port, 0, null);
    }
    
    public String describe() {
        return type == ProbeType.HTTP ? url : host + ":" + port;
    }
}
