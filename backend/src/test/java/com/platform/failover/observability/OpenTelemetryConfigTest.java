package com.platform.failover.observability;

import com.platform.failover.support.TestFleets;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link OpenTelemetryConfig}.
 */
class OpenTelemetryConfigTest {

    private OpenTelemetryConfig config;

    @BeforeEach
    void setUp() {
        config = new OpenTelemetryConfig();
        ReflectionTestUtils.setField(config, "applicationName", "region-failover-controller");
        ReflectionTestUtils.setField(config, "version", "1.0.0");
        ReflectionTestUtils.setField(config, "environment", "test");
        ReflectionTestUtils.setField(config, "endpoint", "http://localhost:1");
        ReflectionTestUtils.setField(config, "sampleRatio", 1.0);
        ReflectionTestUtils.setField(config, "hostname", "controller-0");
    }

    @Test
    @DisplayName("enabled tracing records sampled failover spans")
    void enabledTracing() {
        ReflectionTestUtils.setField(config, "enabled", true);

        try (OpenTelemetrySdk sdk = config.openTelemetry(TestFleets.fleetOf(TestFleets.checkout()))) {
            Span span = config.tracer(sdk).spanBuilder("failover checkout").startSpan();
            try {
                assertThat(span.getSpanContext().isValid()).isTrue();
                assertThat(span.getSpanContext().isSampled()).isTrue();
            } finally {
                span.end();
            }
        }
    }

    @Test
    @DisplayName("disabled tracing hands out non-recording spans")
    void disabledTracing() {
        ReflectionTestUtils.setField(config, "enabled", false);

        try (OpenTelemetrySdk sdk = config.openTelemetry(TestFleets.fleetOf(TestFleets.checkout()))) {
            Span span = config.tracer(sdk).spanBuilder("failover checkout").startSpan();
            assertThat(span.isRecording()).isFalse();
            span.end();
        }
    }
}
