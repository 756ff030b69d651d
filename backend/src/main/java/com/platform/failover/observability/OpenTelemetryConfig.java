package com.platform.failover.observability;

import com.platform.failover.config.Fleet;
import com.platform.failover.model.ServiceDefinition;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Tracing for failover workflows. Each failover run and its steps become spans tagged
 * with the controller instance and the services it guards.
 *
 * {@code failover.tracing.enabled=false} samples nothing.
 */
@Slf4j
@Configuration
public class OpenTelemetryConfig {
    
    static final String INSTRUMENTATION_SCOPE = "com.platform.failover";
    
    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    private static final AttributeKey<String> SERVICE_INSTANCE = AttributeKey.stringKey("service.instance.id");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");
    private static final AttributeKey<List<String>> GUARDED_SERVICES = AttributeKey.stringArrayKey("failover.guarded_services");
    
    @Value("${spring.application.name:region-failover-controller}")
    private String applicationName;
    
    @Value("${failover.tracing.version:1.0.0}")
    private String version;
    
    @Value("${failover.tracing.environment:development}")
    private String environment;
    
    @Value("${failover.tracing.endpoint:http://localhost:4317}")
    private String endpoint;
    
    @Value("${failover.tracing.sample-ratio:1.0}")
    private double sampleRatio;
    
    @Value("${failover.tracing.enabled:true}")
    private boolean enabled;
    
    @Value("${HOSTNAME:}")
    private String hostname;
    
    @Bean
    public OpenTelemetrySdk openTelemetry(Fleet fleet) {
        if (!enabled) {
            log.info("Failover tracing disabled");
            return OpenTelemetrySdk.builder()
                .setTracerProvider(SdkTracerProvider.builder().setSampler(Sampler.alwaysOff()).build())
                .build();
        }
        
        String instance = hostname.isBlank() ? UUID.randomUUID().toString().substring(0, 8) : hostname;
        List<String> guarded = fleet.services().stream().map(ServiceDefinition::serviceId).toList();
        
        Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
            .put(SERVICE_NAME, applicationName)
            .put(SERVICE_VERSION, version)
            .put(SERVICE_INSTANCE, instance)
            .put(DEPLOYMENT_ENVIRONMENT, environment)
            .put(GUARDED_SERVICES, guarded)
            .build()));
        
        // small batches, flushed every second
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .setResource(resource)
            .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(sampleRatio)))
            .addSpanProcessor(BatchSpanProcessor.builder(OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(5, TimeUnit.SECONDS)
                    .build())
                .setMaxQueueSize(512)
                .setScheduleDelay(1, TimeUnit.SECONDS)
                .build())
            .build();
        
        log.info("Failover tracing to {} as {} ({}), sampling {}, guarding {}",
            endpoint, instance, environment, sampleRatio, guarded);
        
        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
            .build();
    }
    
    @Bean
    public Tracer tracer(OpenTelemetrySdk openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_SCOPE, version);
    }
}
