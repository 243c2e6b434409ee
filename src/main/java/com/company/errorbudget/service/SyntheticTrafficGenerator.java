package com.company.errorbudget.service;

import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.TrafficSample;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Demo traffic: a diurnal request curve with random incidents during which the
 * error rate jumps 5-50x for 5-30 minutes. Chaos level 0 gives steady traffic.
 */
@Slf4j
public class SyntheticTrafficGenerator {

    static final Map<String, Profile> PROFILES = Map.of(
            "api-gateway", new Profile(10_000, 0.001),
            "user-service", new Profile(5_000, 0.002),
            "payment-service", new Profile(2_000, 0.0005),
            "inventory-service", new Profile(3_000, 0.001),
            "notification-service", new Profile(8_000, 0.003),
            "search-service", new Profile(6_000, 0.002),
            "recommendation-engine", new Profile(4_000, 0.001),
            "auth-service", new Profile(7_000, 0.0008)
    );

    private static final double INCIDENT_PROBABILITY = 0.01;
    private static final int MIN_INCIDENT_SECONDS = 300;
    private static final int MAX_INCIDENT_SECONDS = 1800;

    private final Random random;
    private final double chaosLevel;
    private final Map<Long, Incident> incidents = new ConcurrentHashMap<>();

    public SyntheticTrafficGenerator(Random random, double chaosLevel) {
        this.random = random;
        this.chaosLevel = Math.max(0.0, chaosLevel);
    }

    /**
     * Names with a built-in traffic profile.
     */
    public static Set<String> demoServiceNames() {
        return new TreeSet<>(PROFILES.keySet());
    }

    public TrafficSample generate(MonitoredService service, Instant at, Duration interval) {
        Profile profile = profileFor(service);

        double variance = Math.max(0.0, gaussian(1.0, 0.1 * chaosLevel));
        long total = Math.round(profile.requestsPerSecond * interval.getSeconds()
                * diurnalFactor(at) * variance);

        double errorRate = errorRate(service, profile, at);
        long errors = Math.min(total, Math.round(total * errorRate));

        return TrafficSample.builder()
                .serviceId(service.getServiceId())
                .timestamp(at)
                .successCount(total - errors)
                .errorCount(errors)
                .build();
    }

    public boolean isInIncident(Long serviceId, Instant at) {
        Incident incident = incidents.get(serviceId);
        return incident != null && at.isBefore(incident.endsAt);
    }

    /**
     * Load peaks at noon UTC and bottoms out at midnight.
     */
    static double diurnalFactor(Instant at) {
        int hour = at.atZone(ZoneOffset.UTC).getHour();
        return 1.0 + 0.3 * Math.sin(hour / 24.0 * 2 * Math.PI - Math.PI / 2);
    }

    static Profile profileFor(MonitoredService service) {
        Profile profile = PROFILES.get(service.getName());
        if (profile != null) {
            return profile;
        }
        int tier = service.getTier() != null ? service.getTier() : 2;
        return switch (tier) {
            case 1 -> new Profile(5_000, 0.001);
            case 3 -> new Profile(1_000, 0.002);
            default -> new Profile(3_000, 0.001);
        };
    }

    private double errorRate(MonitoredService service, Profile profile, Instant at) {
        Incident incident = incidents.get(service.getServiceId());
        if (incident != null && !at.isBefore(incident.endsAt)) {
            log.info("Synthetic incident on {} ended", service.getName());
            incidents.remove(service.getServiceId());
            incident = null;
        }

        if (incident == null && chaosLevel > 0.0 && random.nextDouble() < INCIDENT_PROBABILITY * chaosLevel) {
            int seconds = MIN_INCIDENT_SECONDS + random.nextInt(MAX_INCIDENT_SECONDS - MIN_INCIDENT_SECONDS + 1);
            double multiplier = 5.0 + random.nextDouble() * 45.0;
            incident = new Incident(at.plusSeconds(seconds), multiplier);
            incidents.put(service.getServiceId(), incident);
            log.info("Synthetic incident on {} for {}s at {}x error rate",
                    service.getName(), seconds, String.format("%.1f", multiplier));
        }

        double rate = incident != null
                ? profile.baseErrorRate * incident.multiplier
                : profile.baseErrorRate * gaussian(1.0, 0.2 * chaosLevel);
        return Math.min(1.0, Math.max(0.0, rate));
    }

    private double gaussian(double mean, double stdDev) {
        return mean + random.nextGaussian() * stdDev;
    }

    static final class Profile {
        final double requestsPerSecond;
        final double baseErrorRate;

        Profile(double requestsPerSecond, double baseErrorRate) {
            this.requestsPerSecond = requestsPerSecond;
            this.baseErrorRate = baseErrorRate;
        }
    }

    private static final class Incident {
        private final Instant endsAt;
        private final double multiplier;

        private Incident(Instant endsAt, double multiplier) {
            this.endsAt = endsAt;
            this.multiplier = multiplier;
        }
    }
}
