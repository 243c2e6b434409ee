package com.company.errorbudget.service;

import com.company.errorbudget.domain.Alert;
import com.company.errorbudget.exception.AlertSendException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Notification sink. Emits every alert as a trace span that the collector routes
 * to the on-call channel.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AlertNotificationSender {

    private final Tracer tracer;

    @Retry(name = "alertNotifier")
    @CircuitBreaker(name = "alertNotifier")
    public void send(Alert alert) {
        Span span = tracer.spanBuilder("errorbudget.alert")
                .setSpanKind(SpanKind.PRODUCER)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("alert.id", alert.getAlertId());
            span.setAttribute("service.name", alert.getServiceName());
            span.setAttribute("alert.category", alert.getCategory().name());
            span.setAttribute("alert.severity", alert.getSeverity().name());
            if (alert.getRiskLevel() != null) {
                span.setAttribute("risk.level", alert.getRiskLevel().name());
            }

            span.addEvent(alert.getTitle(),
                    Attributes.of(
                            AttributeKey.stringKey("message"), alert.getMessage(),
                            AttributeKey.longKey("retry_count"),
                            alert.getRetryCount() != null ? alert.getRetryCount().longValue() : 0L
                    ));

            log.info("Alert {} [{}] delivered for service {}",
                    alert.getAlertId(), alert.getSeverity(), alert.getServiceName());

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to deliver alert");
            throw new AlertSendException("Failed to deliver alert " + alert.getAlertId(), e);
        } finally {
            span.end();
        }
    }
}
