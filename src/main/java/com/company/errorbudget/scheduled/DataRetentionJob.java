package com.company.errorbudget.scheduled;

import com.company.errorbudget.repository.BurnRateSnapshotRepository;
import com.company.errorbudget.repository.TrafficSampleRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Nightly purge of traffic samples and snapshots past retention. Sample retention
 * must stay longer than the longest compliance window in use.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "errorbudget.retention.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class DataRetentionJob {

    private final TrafficSampleRepository trafficSampleRepository;
    private final BurnRateSnapshotRepository snapshotRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int sampleDays;
    private final int snapshotDays;

    public DataRetentionJob(TrafficSampleRepository trafficSampleRepository,
                            BurnRateSnapshotRepository snapshotRepository,
                            MeterRegistry meterRegistry,
                            Clock clock,
                            @Value("${errorbudget.retention.sample-days:35}") int sampleDays,
                            @Value("${errorbudget.retention.snapshot-days:90}") int snapshotDays) {
        this.trafficSampleRepository = trafficSampleRepository;
        this.snapshotRepository = snapshotRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.sampleDays = sampleDays;
        this.snapshotDays = snapshotDays;
    }

    @Scheduled(cron = "${errorbudget.retention.cron:0 30 2 * * *}")
    public void purge() {
        Instant now = Instant.now(clock);
        log.info("Starting retention purge (samples {} days, snapshots {} days)", sampleDays, snapshotDays);

        try {
            int samples = trafficSampleRepository.deleteOlderThan(now.minus(Duration.ofDays(sampleDays)));
            int snapshots = snapshotRepository.deleteOlderThan(now.minus(Duration.ofDays(snapshotDays)));

            meterRegistry.counter("errorbudget.retention.deleted", "table", "traffic_samples").increment(samples);
            meterRegistry.counter("errorbudget.retention.deleted", "table", "burn_rate_snapshots").increment(snapshots);

            log.info("Retention purge removed {} samples and {} snapshots", samples, snapshots);
        } catch (Exception e) {
            log.error("Retention purge failed", e);
            meterRegistry.counter("errorbudget.retention.failures").increment();
        }
    }
}
