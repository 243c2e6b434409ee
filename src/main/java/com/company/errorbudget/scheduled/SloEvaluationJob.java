package com.company.errorbudget.scheduled;

import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.service.EvaluationScheduler;
import com.company.errorbudget.service.ServiceCatalogService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic evaluation of every active service. Ticks run on the evaluation
 * executor; this method only submits them.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SloEvaluationJob {

    private final ServiceCatalogService serviceCatalog;
    private final EvaluationScheduler evaluationScheduler;
    private final MeterRegistry meterRegistry;

    @Scheduled(
            fixedDelayString = "${errorbudget.evaluation.interval-ms:60000}",
            initialDelayString = "${errorbudget.evaluation.initial-delay-ms:15000}"
    )
    public void evaluateAll() {
        List<MonitoredService> services;
        try {
            services = serviceCatalog.findActiveServices();
        } catch (Exception e) {
            // Nothing evaluated this round; the next round retries
            log.error("Could not load active services for evaluation", e);
            meterRegistry.counter("errorbudget.evaluation.schedule.failures").increment();
            return;
        }

        if (services.isEmpty()) {
            log.debug("No active services to evaluate");
            return;
        }

        int submitted = 0;
        for (MonitoredService service : services) {
            try {
                evaluationScheduler.submit(service);
                submitted++;
            } catch (Exception e) {
                log.error("Could not submit evaluation tick for {}", service.getName(), e);
            }
        }

        log.debug("Submitted evaluation ticks for {}/{} services", submitted, services.size());
    }
}
