package com.company.errorbudget.service;

import com.company.errorbudget.cache.RedisSnapshotCache;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.dto.request.SloTargetRequest;
import com.company.errorbudget.dto.response.SloTargetResponse;
import com.company.errorbudget.exception.SloTargetNotFoundException;
import com.company.errorbudget.repository.SloTargetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class SloTargetService {

    private final SloTargetRepository sloTargetRepository;
    private final ServiceCatalogService serviceCatalog;
    private final SloTargetDefinitions definitions;
    private final RedisSnapshotCache snapshotCache;

    public List<SloTargetResponse> listTargets(String serviceName) {
        MonitoredService service = serviceCatalog.requireService(serviceName);
        return sloTargetRepository.findByServiceId(service.getServiceId(), false).stream()
                .map(SloTargetResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public SloTargetResponse createTarget(String serviceName, SloTargetRequest request) {
        MonitoredService service = serviceCatalog.requireService(serviceName);
        SloTarget target = sloTargetRepository.save(definitions.newTarget(service.getServiceId(), request));

        log.info("Created SLO target {} ({}%/{}d) for {}",
                target.getName(), target.getTargetValue(), target.getWindowDays(), serviceName);
        return SloTargetResponse.from(target);
    }

    /**
     * Partial update; null fields keep their current value.
     */
    @Transactional
    public SloTargetResponse updateTarget(Long targetId, SloTargetRequest request) {
        SloTarget target = sloTargetRepository.findById(targetId)
                .orElseThrow(() -> new SloTargetNotFoundException(targetId));

        if (request.getName() != null) {
            target.setName(request.getName());
        }
        if (request.getTargetValue() != null) {
            target.setTargetValue(request.getTargetValue());
        }
        if (request.getWindowDays() != null) {
            target.setWindowDays(request.getWindowDays());
        }
        if (request.getBurnRateThreshold() != null) {
            target.setBurnRateThreshold(request.getBurnRateThreshold());
        }
        if (request.getCriticalBurnRate() != null) {
            target.setCriticalBurnRate(request.getCriticalBurnRate());
        }
        if (request.getActive() != null) {
            target.setActive(request.getActive());
        }

        definitions.validate(target);
        sloTargetRepository.update(target);

        // Latest snapshot was classified against the old definition
        snapshotCache.evictTarget(target.getServiceId(), target.getTargetId());

        log.info("Updated SLO target {}: {}%/{}d thresholds {}/{} active={}",
                targetId, target.getTargetValue(), target.getWindowDays(),
                target.getBurnRateThreshold(), target.getCriticalBurnRate(), target.getActive());
        return SloTargetResponse.from(target);
    }
}
