package com.platform.failover.probe;

import com.platform.failover.model.HealthEndpoint;
import com.platform.failover.model.ProbeSample;
import com.platform.failover.model.ProbeType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * TCP health check: healthy when a connection is accepted within the timeout.
 */
@Component
public class TcpHealthProbe implements HealthProbe {
    
    private final Clock clock;
    
    public TcpHealthProbe(Clock clock) {
        this.clock = clock;
    }
    
    @Override
    public ProbeType type() {
        return ProbeType.TCP;
    }
    
    @Override
    public ProbeSample probe(String serviceId, String regionId, HealthEndpoint endpoint, Duration timeout) {
        Instant startedAt = clock.instant();
        long start = System.nanoTime();
        
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(endpoint.host(), endpoint.port()), (int) timeout.toMillis());
            return ProbeSample.success(serviceId, regionId, startedAt, Duration.ofNanos(System.nanoTime() - start));
        } catch (SocketTimeoutException e) {
            return ProbeSample.timeout(serviceId, regionId, startedAt, timeout);
        } catch (IOException e) {
            return ProbeSample.failure(serviceId, regionId, startedAt, Duration.ofNanos(System.nanoTime() - start),
                "connect to " + endpoint.describe() + " failed: " + e.getMessage());
        }
    }
}
