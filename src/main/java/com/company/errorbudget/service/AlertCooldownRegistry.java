package com.company.errorbudget.service;

import com.company.errorbudget.domain.Alert;
import com.company.errorbudget.domain.enums.AlertCategory;
import com.company.errorbudget.domain.enums.AlertSeverity;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cooldown state for alert de-duplication: per (service, category) the last alert
 * raised at each severity.
 *
 * <p>A new alert is suppressed while an unacknowledged alert of the same or higher
 * severity is younger than that alert's cooldown. Check and reservation happen under
 * one lock per (service, category), so concurrent ticks cannot both raise.
 */
@Component
@Slf4j
public class AlertCooldownRegistry {

    private final Map<AlertSeverity, Duration> cooldowns = new EnumMap<>(AlertSeverity.class);
    private final Map<Key, Slot> slots = new ConcurrentHashMap<>();
    private final Map<Long, Key> keysByAlertId = new ConcurrentHashMap<>();

    public AlertCooldownRegistry(
            @Value("${errorbudget.alerts.cooldown.warning:60}") long warningMinutes,
            @Value("${errorbudget.alerts.cooldown.critical:30}") long criticalMinutes,
            @Value("${errorbudget.alerts.cooldown.emergency:15}") long emergencyMinutes) {
        cooldowns.put(AlertSeverity.INFO, Duration.ofMinutes(warningMinutes));
        cooldowns.put(AlertSeverity.WARNING, Duration.ofMinutes(warningMinutes));
        cooldowns.put(AlertSeverity.CRITICAL, Duration.ofMinutes(criticalMinutes));
        cooldowns.put(AlertSeverity.EMERGENCY, Duration.ofMinutes(emergencyMinutes));
    }

    public Duration cooldownFor(AlertSeverity severity) {
        return cooldowns.get(severity);
    }

    /**
     * Atomically checks the cooldown and, when clear, reserves the slot for a new alert.
     * The caller must {@link #bind} the reservation once the alert is stored, or
     * {@link #release} it if storing fails.
     */
    public Optional<Reservation> tryAcquire(Long serviceId, AlertCategory category,
                                            AlertSeverity severity, Instant now) {
        Key key = new Key(serviceId, category);
        Slot slot = slots.computeIfAbsent(key, k -> new Slot());

        synchronized (slot) {
            for (Map.Entry<AlertSeverity, Entry> existing : slot.entries.entrySet()) {
                AlertSeverity existingSeverity = existing.getKey();
                Entry entry = existing.getValue();
                if (!existingSeverity.isAtLeast(severity) || entry.acknowledged) {
                    continue;
                }
                Instant until = entry.raisedAt.plus(cooldownFor(existingSeverity));
                if (now.isBefore(until)) {
                    log.debug("Suppressing {} {} alert for service {}: {} alert {} cooling down until {}",
                            severity, category, serviceId, existingSeverity, entry.alertId, until);
                    return Optional.empty();
                }
            }

            Entry replaced = slot.entries.put(severity, new Entry(now));
            if (replaced != null && replaced.alertId != null) {
                keysByAlertId.remove(replaced.alertId);
            }
            return Optional.of(new Reservation(key, severity, slot.entries.get(severity)));
        }
    }

    public void bind(Reservation reservation, Long alertId) {
        Slot slot = slots.get(reservation.key);
        if (slot == null) {
            return;
        }
        synchronized (slot) {
            if (slot.entries.get(reservation.severity) == reservation.entry) {
                reservation.entry.alertId = alertId;
                keysByAlertId.put(alertId, reservation.key);
            }
        }
    }

    public void release(Reservation reservation) {
        Slot slot = slots.get(reservation.key);
        if (slot == null) {
            return;
        }
        synchronized (slot) {
            slot.entries.remove(reservation.severity, reservation.entry);
        }
    }

    /**
     * An acknowledged alert no longer suppresses new ones.
     */
    public void acknowledge(Long alertId) {
        Key key = keysByAlertId.remove(alertId);
        if (key == null) {
            return;
        }
        Slot slot = slots.get(key);
        if (slot == null) {
            return;
        }
        synchronized (slot) {
            for (Entry entry : slot.entries.values()) {
                if (Objects.equals(entry.alertId, alertId)) {
                    entry.acknowledged = true;
                }
            }
        }
    }

    /**
     * Re-registers a stored unacknowledged alert, e.g. after a restart. Keeps the
     * newer entry when one already exists.
     */
    public void restore(Alert alert) {
        if (alert.isAcknowledged()) {
            return;
        }
        Key key = new Key(alert.getServiceId(), alert.getCategory());
        Slot slot = slots.computeIfAbsent(key, k -> new Slot());
        synchronized (slot) {
            Entry current = slot.entries.get(alert.getSeverity());
            if (current != null && !current.raisedAt.isBefore(alert.getCreatedAt())) {
                return;
            }
            Entry entry = new Entry(alert.getCreatedAt());
            entry.alertId = alert.getAlertId();
            slot.entries.put(alert.getSeverity(), entry);
            keysByAlertId.put(alert.getAlertId(), key);
        }
    }

    @EqualsAndHashCode
    @RequiredArgsConstructor
    private static final class Key {
        private final Long serviceId;
        private final AlertCategory category;
    }

    private static final class Slot {
        private final Map<AlertSeverity, Entry> entries = new EnumMap<>(AlertSeverity.class);
    }

    private static final class Entry {
        private final Instant raisedAt;
        private Long alertId;
        private boolean acknowledged;

        private Entry(Instant raisedAt) {
            this.raisedAt = raisedAt;
        }
    }

    /**
     * Slot claimed by {@link #tryAcquire}; identity-compared on bind and release.
     */
    public static final class Reservation {
        private final Key key;
        private final AlertSeverity severity;
        private final Entry entry;

        private Reservation(Key key, AlertSeverity severity, Entry entry) {
            this.key = key;
            this.severity = severity;
            this.entry = entry;
        }

        public AlertSeverity getSeverity() {
            return severity;
        }
    }
}
