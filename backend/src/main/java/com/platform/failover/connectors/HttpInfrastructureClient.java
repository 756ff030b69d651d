package com.platform.failover.connectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.failover.config.FleetProperties;
import com.platform.failover.error.InfrastructureApiException;
import com.platform.failover.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Client for the infrastructure API that fronts database promotion, traffic routing,
 * write control and replication lag for every service.
 */
@Slf4j
@Component
public class HttpInfrastructureClient implements WriteControlApi, DatabasePromotionApi, TrafficRoutingApi,
        ReplicationLagProvider {
    
    private final String baseUrl;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final HttpClient httpClient;
    
    @Autowired
    public HttpInfrastructureClient(FleetProperties properties, ObjectMapper objectMapper,
                                    MetricsRegistry metricsRegistry) {
        this(properties, objectMapper, metricsRegistry, HttpClient.newBuilder()
            .connectTimeout(properties.getInfrastructure().getTimeout())
            .build());
    }
    
    HttpInfrastructureClient(FleetProperties properties, ObjectMapper objectMapper,
                             MetricsRegistry metricsRegistry, HttpClient httpClient) {
        this.baseUrl = stripTrailingSlash(properties.getInfrastructure().getBaseUrl());
        this.timeout = properties.getInfrastructure().getTimeout();
        this.objectMapper = objectMapper;
        this.metricsRegistry = metricsRegistry;
        this.httpClient = httpClient;
    }
    
    @Override
    public void quiesceWrites(String serviceId, String regionId) {
        post("quiesce-writes", regionPath(serviceId, regionId) + "/writes/quiesce", Map.of());
    }
    
    @Override
    public void resumeWrites(String serviceId, String regionId) {
        post("resume-writes", regionPath(serviceId, regionId) + "/writes/resume", Map.of());
    }
    
    @Override
    public PromotionResult promote(String serviceId, String regionId) {
        HttpResponse<String> response = send("promote",
            request(regionPath(serviceId, regionId) + "/promote")
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build());
        
        if (response.statusCode() == 409) {
            return PromotionResult.ALREADY_PRIMARY;
        }
        requireSuccess("promote", response);
        
        String result = readField("promote", response.body(), "result");
        if (result == null) {
            return PromotionResult.PROMOTED;
        }
        try {
            return PromotionResult.valueOf(result.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InfrastructureApiException("promote", response.statusCode(), "unknown result '" + result + "'");
        }
    }
    
    @Override
    public void demote(String serviceId, String regionId) {
        post("demote", regionPath(serviceId, regionId) + "/demote", Map.of());
    }
    
    @Override
    public void route(String serviceId, String regionId) {
        try {
            String body = objectMapper.writeValueAsString(Map.of("region", regionId));
            HttpResponse<String> response = send("route",
                request("/services/" + encode(serviceId) + "/routing")
                    .PUT(HttpRequest.BodyPublishers.ofString(body))
                    .build());
            requireSuccess("route", response);
        } catch (IOException e) {
            throw new InfrastructureApiException("route", e.getMessage(), e);
        }
    }
    
    @Override
    public Duration replicationLag(String serviceId, String regionId) {
        HttpResponse<String> response = send("replication-lag",
            request(regionPath(serviceId, regionId) + "/replication-lag").GET().build());
        requireSuccess("replication-lag", response);
        
        String seconds = readField("replication-lag", response.body(), "lagSeconds");
        if (seconds == null) {
            throw new InfrastructureApiException("replication-lag", response.statusCode(), "missing lagSeconds");
        }
        double lag;
        try {
            lag = Double.parseDouble(seconds);
        } catch (NumberFormatException e) {
            throw new InfrastructureApiException("replication-lag", "invalid lagSeconds '" + seconds + "'", e);
        }
        if (!Double.isFinite(lag) || lag < 0) {
            throw new InfrastructureApiException("replication-lag", response.statusCode(),
                "unusable lagSeconds '" + seconds + "'");
        }
        return Duration.ofMillis(Math.round(lag * 1000));
    }
    
    private void post(String operation, String path, Map<String, Object> payload) {
        try {
            HttpResponse<String> response = send(operation,
                request(path)
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                    .build());
            requireSuccess(operation, response);
        } catch (IOException e) {
            throw new InfrastructureApiException(operation, e.getMessage(), e);
        }
    }
    
    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");
    }
    
    private HttpResponse<String> send(String operation, HttpRequest request) {
        long start = System.currentTimeMillis();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            log.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
            return response;
        } catch (IOException e) {
            metricsRegistry.incrementCounter("failover.infrastructure.errors", "operation", operation);
            throw new InfrastructureApiException(operation, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InfrastructureApiException(operation, "interrupted", e);
        } finally {
            metricsRegistry.recordLatency("infrastructure", operation, System.currentTimeMillis() - start);
        }
    }
    
    private void requireSuccess(String operation, HttpResponse<String> response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            metricsRegistry.incrementCounter("failover.infrastructure.errors", "operation", operation);
            throw new InfrastructureApiException(operation, response.statusCode(), response.body());
        }
    }
    
    private String readField(String operation, String body, String field) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body).get(field);
            return node == null || node.isNull() ? null : node.asText();
        } catch (IOException e) {
            throw new InfrastructureApiException(operation, "unreadable response: " + e.getMessage(), e);
        }
    }
    
    private static String regionPath(String serviceId, String regionId) {
        return "/services/" + encode(serviceId) + "/regions/" + encode(regionId);
    }
    
    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
    
    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
