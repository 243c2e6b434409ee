package com.company.errorbudget.config;

import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.enums.AlertSeverity;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.company.errorbudget.event.SnapshotEvaluatedEvent;
import com.company.errorbudget.repository.AlertRepository;
import com.company.errorbudget.repository.MonitoredServiceRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final MonitoredServiceRepository serviceRepository;
    private final AlertRepository alertRepository;

    // serviceId -> (targetId -> last risk)
    private final Map<Long, Map<Long, RiskLevel>> latestRisk = new ConcurrentHashMap<>();

    @Bean
    public MeterBinder errorBudgetMetrics() {
        return (reg) -> {
            Gauge.builder("errorbudget.services.active", serviceRepository, repo -> {
                        try {
                            return repo.countActive();
                        } catch (Exception e) {
                            log.warn("Failed to count active services", e);
                            return 0;
                        }
                    })
                    .description("Number of active monitored services")
                    .register(reg);

            Gauge.builder("errorbudget.alerts.unacknowledged", alertRepository, repo -> {
                        try {
                            return repo.countUnacknowledged();
                        } catch (Exception e) {
                            log.warn("Failed to count unacknowledged alerts", e);
                            return 0;
                        }
                    })
                    .description("Alerts awaiting acknowledgement")
                    .register(reg);

            Gauge.builder("errorbudget.alerts.unacknowledged.critical", alertRepository, repo -> {
                        try {
                            return repo.countUnacknowledgedAtLeast(AlertSeverity.CRITICAL);
                        } catch (Exception e) {
                            log.warn("Failed to count critical alerts", e);
                            return 0;
                        }
                    })
                    .description("Unacknowledged alerts of severity CRITICAL or above")
                    .register(reg);

            for (RiskLevel level : RiskLevel.values()) {
                Gauge.builder("errorbudget.services.by_risk", latestRisk, risks -> countAt(risks, level))
                        .tag("risk", level.name())
                        .description("Services whose worst SLO target is at this risk level")
                        .register(reg);
            }

            log.info("Custom metrics registered");
        };
    }

    @EventListener
    public void onSnapshotEvaluated(SnapshotEvaluatedEvent event) {
        BurnRateSnapshot snapshot = event.getSnapshot();
        latestRisk.computeIfAbsent(snapshot.getServiceId(), id -> new ConcurrentHashMap<>())
                .put(snapshot.getSloTargetId(), snapshot.getRiskLevel());
    }

    static double countAt(Map<Long, Map<Long, RiskLevel>> risks, RiskLevel level) {
        return risks.values().stream()
                .map(byTarget -> byTarget.values().stream()
                        .max((a, b) -> Integer.compare(a.getRank(), b.getRank()))
                        .orElse(RiskLevel.SAFE))
                .filter(worst -> worst == level)
                .count();
    }
}
