package com.company.errorbudget.service;

import com.company.errorbudget.domain.Alert;
import com.company.errorbudget.domain.enums.AlertStatus;
import com.company.errorbudget.event.AlertRaisedEvent;
import com.company.errorbudget.repository.AlertRepository;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Delivers alerts to the notification sink and records the outcome on the alert.
 * Delivery problems never reach the evaluation path; undelivered alerts are picked
 * up again by the redelivery job.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertDispatchService {

    private final AlertRepository alertRepository;
    private final AlertNotificationSender notificationSender;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @EventListener
    @Async
    public void handleAlertRaised(AlertRaisedEvent event) {
        deliver(event.getAlert());
    }

    /**
     * @return true when the sink accepted the alert
     */
    public boolean deliver(Alert alert) {
        int attempts = alert.getRetryCount() != null ? alert.getRetryCount() : 0;

        try {
            notificationSender.send(alert);

            alert.setDeliveryStatus(AlertStatus.SENT);
            alert.setDeliveredAt(Instant.now(clock));
            alert.setLastError(null);
            alertRepository.updateDelivery(alert);

            meterRegistry.counter("errorbudget.alerts.delivered",
                    "severity", alert.getSeverity().name()
            ).increment();
            return true;

        } catch (CallNotPermittedException e) {
            log.warn("Notification sink unavailable, alert {} stays pending: {}",
                    alert.getAlertId(), e.getMessage());

            alert.setDeliveryStatus(AlertStatus.PENDING);
            alert.setRetryCount(attempts + 1);
            alert.setLastError("Circuit open: " + e.getMessage());
            alertRepository.updateDelivery(alert);

            meterRegistry.counter("errorbudget.alerts.circuit_open").increment();
            return false;

        } catch (RuntimeException e) {
            log.error("Failed to deliver alert {}", alert.getAlertId(), e);

            alert.setDeliveryStatus(AlertStatus.FAILED);
            alert.setRetryCount(attempts + 1);
            alert.setLastError(e.getMessage());
            alertRepository.updateDelivery(alert);

            meterRegistry.counter("errorbudget.alerts.delivery_failed",
                    "severity", alert.getSeverity().name()
            ).increment();
            return false;
        }
    }
}
