package com.platform.failover.probe;

import com.platform.failover.model.HealthEndpoint;
import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.ProbeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP health check: healthy when the response carries the expected status and, if
 * configured, contains the expected content.
 */
@Slf4j
@Component
public class HttpHealthProbe implements HealthProbe {
    
    private final HttpClient httpClient;
    private final Clock clock;
    
    @Autowired
    public HttpHealthProbe(Clock clock) {
        this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .build(), clock);
    }
    
    HttpHealthProbe(HttpClient httpClient, Clock clock) {
        this.httpClient = httpClient;
        this.clock = clock;
    }
    
    @Override
    public ProbeType type() {
        return ProbeType.HTTP;
    }
    
    @Override
    public ProbeSample probe(String serviceId, String regionId, HealthEndpoint endpoint, Duration timeout) {
        Instant startedAt = clock.instant();
        long start = System.nanoTime();
        
        CompletableFuture<HttpResponse<String>> pending = null;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint.url()))
                .timeout(timeout)
                .header("User-Agent", "region-failover-controller")
                .GET()
                .build();
            
            pending = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            Duration latency = elapsed(start);
            
            if (response.statusCode() != endpoint.expectedStatus()) {
                return ProbeSample.failure(serviceId, regionId, startedAt, latency,
                    "status " + response.statusCode() + ", expected " + endpoint.expectedStatus());
            }
            if (endpoint.expectedContent() != null
                    && (response.body() == null || !response.body().contains(endpoint.expectedContent()))) {
                return ProbeSample.failure(serviceId, regionId, startedAt, latency,
                    "expected content not found in response body");
            }
            return ProbeSample.success(serviceId, regionId, startedAt, latency);
            
        } catch (TimeoutException e) {
            pending.cancel(true);
            return ProbeSample.timeout(serviceId, regionId, startedAt, timeout);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof HttpTimeoutException) {
                return ProbeSample.timeout(serviceId, regionId, startedAt, timeout);
            }
            return ProbeSample.failure(serviceId, regionId, startedAt, elapsed(start), describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (pending != null) {
                pending.cancel(true);
            }
            return ProbeSample.failure(serviceId, regionId, startedAt, elapsed(start), "probe interrupted");
        } catch (IllegalArgumentException e) {
            log.warn("Invalid health endpoint {} for {}/{}: {}", endpoint.url(), serviceId, regionId, e.getMessage());
            return ProbeSample.failure(serviceId, regionId, startedAt, elapsed(start), describe(e));
        }
    }
    
    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
    
    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        return t.getClass().getSimpleName() + (t.getMessage() != null ? ": " + t.getMessage() : "");
    }
}
