package com.company.errorbudget.scheduled;

import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.TrafficSample;
import com.company.errorbudget.dto.request.CreateServiceRequest;
import com.company.errorbudget.exception.DuplicateServiceException;
import com.company.errorbudget.repository.TrafficSampleRepository;
import com.company.errorbudget.service.ServiceCatalogService;
import com.company.errorbudget.service.SyntheticTrafficGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Demo only: writes one synthetic traffic sample per active service per interval.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "errorbudget.synthetic-metrics.enabled",
        havingValue = "true",
        matchIfMissing = false
)
public class SyntheticTrafficJob {

    private final ServiceCatalogService serviceCatalog;
    private final TrafficSampleRepository trafficSampleRepository;
    private final SyntheticTrafficGenerator generator;
    private final Clock clock;
    private final Duration interval;
    private final boolean seedServices;

    public SyntheticTrafficJob(ServiceCatalogService serviceCatalog,
                               TrafficSampleRepository trafficSampleRepository,
                               Clock clock,
                               @Value("${errorbudget.synthetic-metrics.chaos-level:1.0}") double chaosLevel,
                               @Value("${errorbudget.synthetic-metrics.interval-ms:60000}") long intervalMs,
                               @Value("${errorbudget.synthetic-metrics.seed-services:true}") boolean seedServices) {
        this.serviceCatalog = serviceCatalog;
        this.trafficSampleRepository = trafficSampleRepository;
        this.generator = new SyntheticTrafficGenerator(new Random(), chaosLevel);
        this.clock = clock;
        this.interval = Duration.ofMillis(intervalMs);
        this.seedServices = seedServices;
        log.warn("Synthetic traffic generation is enabled (chaos level {})", chaosLevel);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seedDemoServices() {
        if (!seedServices) {
            return;
        }
        for (String name : SyntheticTrafficGenerator.demoServiceNames()) {
            try {
                serviceCatalog.createService(CreateServiceRequest.builder()
                        .name(name)
                        .description("Synthetic demo service")
                        .ownerTeam("demo")
                        .tier(name.equals("payment-service") || name.equals("auth-service") ? 1 : 2)
                        .build());
            } catch (DuplicateServiceException e) {
                log.debug("Demo service {} already registered", name);
            }
        }
    }

    @Scheduled(
            fixedDelayString = "${errorbudget.synthetic-metrics.interval-ms:60000}",
            initialDelayString = "${errorbudget.synthetic-metrics.initial-delay-ms:5000}"
    )
    public void generate() {
        try {
            Instant now = Instant.now(clock);
            List<TrafficSample> samples = new ArrayList<>();
            for (MonitoredService service : serviceCatalog.findActiveServices()) {
                samples.add(generator.generate(service, now, interval));
            }
            if (!samples.isEmpty()) {
                trafficSampleRepository.saveAll(samples);
                log.debug("Generated {} synthetic samples", samples.size());
            }
        } catch (Exception e) {
            log.error("Synthetic traffic generation failed", e);
        }
    }
}
