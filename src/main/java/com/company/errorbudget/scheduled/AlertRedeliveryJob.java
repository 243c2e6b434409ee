package com.company.errorbudget.scheduled;

import com.company.errorbudget.domain.Alert;
import com.company.errorbudget.repository.AlertRepository;
import com.company.errorbudget.service.AlertDispatchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Retries alerts whose notification did not go through.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "errorbudget.alerts.redelivery.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AlertRedeliveryJob {

    private final AlertRepository alertRepository;
    private final AlertDispatchService dispatchService;
    private final int maxRetries;
    private final int batchSize;

    public AlertRedeliveryJob(AlertRepository alertRepository,
                              AlertDispatchService dispatchService,
                              @Value("${errorbudget.alerts.redelivery.max-retries:5}") int maxRetries,
                              @Value("${errorbudget.alerts.redelivery.batch-size:100}") int batchSize) {
        this.alertRepository = alertRepository;
        this.dispatchService = dispatchService;
        this.maxRetries = maxRetries;
        this.batchSize = batchSize;
    }

    @Scheduled(
            fixedDelayString = "${errorbudget.alerts.redelivery.interval-ms:300000}",
            initialDelayString = "60000"
    )
    public void redeliverPending() {
        List<Alert> pending;
        try {
            pending = alertRepository.findPendingDelivery(maxRetries, batchSize);
        } catch (Exception e) {
            log.error("Could not load undelivered alerts", e);
            return;
        }

        if (pending.isEmpty()) {
            log.debug("No undelivered alerts");
            return;
        }

        log.info("Redelivering {} alerts", pending.size());

        int delivered = 0;
        for (Alert alert : pending) {
            if (dispatchService.deliver(alert)) {
                delivered++;
            }
        }

        log.info("Alert redelivery completed: {} succeeded, {} failed",
                delivered, pending.size() - delivered);
    }
}
