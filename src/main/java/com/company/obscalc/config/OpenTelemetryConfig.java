package com.company.obscalc.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class OpenTelemetryConfig {

    /**
     * SDK configured from the standard OTEL_* environment when tracing is
     * enabled, a no-op otherwise.
     */
    @Bean
    public OpenTelemetry openTelemetry(@Value("${obscalc.tracing.enabled:false}") boolean tracingEnabled) {
        if (!tracingEnabled) {
            log.info("Tracing disabled, using no-op OpenTelemetry");
            return OpenTelemetry.noop();
        }
        return AutoConfiguredOpenTelemetrySdk.initialize().getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer("obscalc-service");
    }
}
