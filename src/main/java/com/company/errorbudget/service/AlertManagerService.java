package com.company.errorbudget.service;

import com.company.errorbudget.domain.Alert;
import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.domain.enums.AlertCategory;
import com.company.errorbudget.domain.enums.AlertSeverity;
import com.company.errorbudget.domain.enums.AlertStatus;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.company.errorbudget.dto.response.AcknowledgeResponse;
import com.company.errorbudget.dto.response.AlertFeedResponse;
import com.company.errorbudget.dto.response.AlertResponse;
import com.company.errorbudget.dto.response.AlertStatisticsResponse;
import com.company.errorbudget.event.AlertRaisedEvent;
import com.company.errorbudget.exception.AlertNotFoundException;
import com.company.errorbudget.repository.AlertRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Raises alerts on risk transitions and on repeated evaluation failures, and owns
 * their acknowledgement.
 *
 * <p>An SLO alert is raised when the risk level of a target changes to OBSERVE or
 * above and the cooldown registry has no unacknowledged alert of the same or a
 * higher severity cooling down for the service.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertManagerService {

    private final AlertRepository alertRepository;
    private final AlertCooldownRegistry cooldownRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * @param previousRisk risk of the target before this evaluation, null on the first one
     * @return the alert raised, if any
     */
    public Optional<Alert> onSnapshotEvaluated(MonitoredService service, SloTarget target,
                                               RiskLevel previousRisk, BurnRateSnapshot snapshot) {
        RiskLevel currentRisk = snapshot.getRiskLevel();
        if (currentRisk == previousRisk) {
            return Optional.empty();
        }

        Optional<AlertSeverity> severity = currentRisk.alertSeverity();
        if (severity.isEmpty()) {
            if (previousRisk != null) {
                log.info("Service {} target {} recovered: {} -> {}",
                        service.getName(), target.getName(), previousRisk, currentRisk);
            }
            return Optional.empty();
        }

        Alert alert = Alert.builder()
                .serviceId(service.getServiceId())
                .serviceName(service.getName())
                .sloTargetId(target.getTargetId())
                .category(AlertCategory.SLO_RISK)
                .severity(severity.get())
                .riskLevel(currentRisk)
                .title(riskTitle(currentRisk, service.getName()))
                .message(riskMessage(service, target, previousRisk, snapshot))
                .createdAt(snapshot.getEvaluatedAt())
                .build();

        return raise(alert);
    }

    /**
     * Evaluation of a service keeps failing; distinct from SLO risk alerts.
     */
    public Optional<Alert> raiseOperationalAlert(MonitoredService service, int consecutiveFailures, String lastError) {
        Alert alert = Alert.builder()
                .serviceId(service.getServiceId())
                .serviceName(service.getName())
                .category(AlertCategory.OPERATIONAL)
                .severity(AlertSeverity.CRITICAL)
                .title("[OPERATIONAL] Evaluation Failing: " + service.getName())
                .message(String.format(Locale.ROOT,
                        "SLO evaluation for %s failed %d consecutive times (last error: %s). "
                                + "Release checks use the last completed snapshot until evaluation recovers.",
                        service.getName(), consecutiveFailures, lastError))
                .createdAt(Instant.now(clock))
                .build();

        return raise(alert);
    }

    private Optional<Alert> raise(Alert alert) {
        Optional<AlertCooldownRegistry.Reservation> reservation = cooldownRegistry.tryAcquire(
                alert.getServiceId(), alert.getCategory(), alert.getSeverity(), alert.getCreatedAt());

        if (reservation.isEmpty()) {
            meterRegistry.counter("errorbudget.alerts.suppressed",
                    "category", alert.getCategory().name(),
                    "severity", alert.getSeverity().name()
            ).increment();
            return Optional.empty();
        }

        Alert saved;
        try {
            alert.setDeliveryStatus(AlertStatus.PENDING);
            alert.setRetryCount(0);
            saved = alertRepository.save(alert);
        } catch (RuntimeException e) {
            cooldownRegistry.release(reservation.get());
            throw e;
        }
        cooldownRegistry.bind(reservation.get(), saved.getAlertId());

        meterRegistry.counter("errorbudget.alerts.raised",
                "category", saved.getCategory().name(),
                "severity", saved.getSeverity().name()
        ).increment();

        log.warn("Alert {} raised: {}", saved.getAlertId(), saved.getTitle());

        eventPublisher.publishEvent(new AlertRaisedEvent(saved));
        return Optional.of(saved);
    }

    public AlertResponse acknowledge(Long alertId, String acknowledgedBy) {
        Alert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new AlertNotFoundException(alertId));

        if (!alert.isAcknowledged()) {
            alertRepository.acknowledge(List.of(alertId), acknowledgedBy, Instant.now(clock));
            cooldownRegistry.acknowledge(alertId);
            log.info("Alert {} acknowledged by {}", alertId, acknowledgedBy);
            alert = alertRepository.findById(alertId).orElse(alert);
        }
        return AlertResponse.from(alert);
    }

    public AcknowledgeResponse acknowledgeBulk(List<Long> alertIds, String acknowledgedBy) {
        Set<Long> ids = new LinkedHashSet<>(alertIds);
        int updated = alertRepository.acknowledge(ids, acknowledgedBy, Instant.now(clock));
        ids.forEach(cooldownRegistry::acknowledge);

        log.info("{} of {} alerts acknowledged by {}", updated, ids.size(), acknowledgedBy);

        return AcknowledgeResponse.builder()
                .requested(ids.size())
                .acknowledged(updated)
                .acknowledgedBy(acknowledgedBy)
                .build();
    }

    public AlertFeedResponse getFeed(Long serviceId, AlertSeverity severity, Boolean acknowledged,
                                     int hours, int limit) {
        Instant since = Instant.now(clock).minus(Duration.ofHours(hours));
        List<Alert> alerts = alertRepository.findFeed(serviceId, severity, acknowledged, since, limit);

        return AlertFeedResponse.builder()
                .alerts(alerts.stream().map(AlertResponse::from).collect(Collectors.toList()))
                .total(alerts.size())
                .unacknowledged((int) alerts.stream().filter(a -> !a.isAcknowledged()).count())
                .build();
    }

    public AlertStatisticsResponse getStatistics(int hours) {
        Instant since = Instant.now(clock).minus(Duration.ofHours(hours));
        Map<AlertSeverity, Long> counts = alertRepository.countBySeveritySince(since);

        Map<String, Long> bySeverity = new LinkedHashMap<>();
        for (AlertSeverity severity : AlertSeverity.values()) {
            bySeverity.put(severity.name(), counts.getOrDefault(severity, 0L));
        }

        return AlertStatisticsResponse.builder()
                .periodHours(hours)
                .total(bySeverity.values().stream().mapToLong(Long::longValue).sum())
                .unacknowledged(alertRepository.countUnacknowledged())
                .bySeverity(bySeverity)
                .build();
    }

    /**
     * Rebuilds cooldown state from alerts still cooling down, so a restart does not
     * re-alert on a transition that was already reported.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void restoreCooldowns() {
        Duration longest = Arrays.stream(AlertSeverity.values())
                .map(cooldownRegistry::cooldownFor)
                .max(Comparator.naturalOrder())
                .orElse(Duration.ofHours(1));

        try {
            List<Alert> recent = alertRepository.findUnacknowledgedSince(Instant.now(clock).minus(longest));
            recent.forEach(cooldownRegistry::restore);
            log.info("Restored cooldown state from {} unacknowledged alerts", recent.size());
        } catch (RuntimeException e) {
            log.warn("Could not restore alert cooldowns, starting empty: {}", e.getMessage());
        }
    }

    private String riskTitle(RiskLevel risk, String serviceName) {
        return switch (risk) {
            case FREEZE -> "[EMERGENCY] Deployment Freeze: " + serviceName;
            case DANGER -> "[CRITICAL] Error Budget In Danger: " + serviceName;
            case OBSERVE -> "[WARNING] Elevated Burn Rate: " + serviceName;
            case SAFE -> "[INFO] Service Healthy: " + serviceName;
        };
    }

    private String riskMessage(MonitoredService service, SloTarget target, RiskLevel previousRisk,
                               BurnRateSnapshot snapshot) {
        String consequence = switch (snapshot.getRiskLevel()) {
            case FREEZE -> "Deployments are frozen; halt non-critical changes.";
            case DANGER -> "Deployments are blocked unless overridden with justification.";
            case OBSERVE -> "Deployments are allowed; monitor closely.";
            case SAFE -> "No action required.";
        };

        return String.format(Locale.ROOT,
                "%s %s SLO (%.3f%%) risk changed from %s to %s. Composite burn rate %.2fx the allowed rate, "
                        + "%.1f%% error budget remaining. %s",
                service.getName(), target.getName(), target.getTargetValue(),
                previousRisk != null ? previousRisk : "UNKNOWN", snapshot.getRiskLevel(),
                snapshot.getCompositeBurnRate(), snapshot.getErrorBudgetRemaining(), consequence);
    }
}
