package com.company.errorbudget.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * The otel.* values from application.yml are only defaults; OTEL_* environment
 * variables and system properties still win.
 */
@Configuration
public class OpenTelemetryConfig {

    @Bean
    public OpenTelemetry openTelemetry(
            @Value("${otel.service.name:error-budget-service}") String serviceName,
            @Value("${otel.traces.exporter:none}") String tracesExporter,
            @Value("${otel.metrics.exporter:none}") String metricsExporter,
            @Value("${otel.logs.exporter:none}") String logsExporter) {
        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(() -> Map.of(
                        "otel.service.name", serviceName,
                        "otel.traces.exporter", tracesExporter,
                        "otel.metrics.exporter", metricsExporter,
                        "otel.logs.exporter", logsExporter))
                .build()
                .getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer("error-budget-service");
    }
}
