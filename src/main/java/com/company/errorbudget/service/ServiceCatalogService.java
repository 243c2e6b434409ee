package com.company.errorbudget.service;

import com.company.errorbudget.cache.RedisSnapshotCache;
import com.company.errorbudget.config.RedisCacheConfig;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.dto.request.CreateServiceRequest;
import com.company.errorbudget.dto.request.SloTargetRequest;
import com.company.errorbudget.dto.request.UpdateServiceRequest;
import com.company.errorbudget.dto.response.ServiceResponse;
import com.company.errorbudget.exception.DuplicateServiceException;
import com.company.errorbudget.exception.InvalidServiceRequestException;
import com.company.errorbudget.exception.ServiceNotFoundException;
import com.company.errorbudget.repository.MonitoredServiceRepository;
import com.company.errorbudget.repository.SloTargetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registered services and their lifecycle. Deleting deactivates; history stays.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ServiceCatalogService {

    // Literal path segments next to /{serviceName} routes
    static final Set<String> RESERVED_NAMES = Set.of("statistics");

    private final MonitoredServiceRepository serviceRepository;
    private final SloTargetRepository sloTargetRepository;
    private final SloTargetDefinitions definitions;
    private final RedisSnapshotCache snapshotCache;

    /**
     * Active service by name.
     */
    @Cacheable(value = RedisCacheConfig.SERVICES, key = "#name")
    public MonitoredService requireService(String name) {
        return serviceRepository.findByName(name)
                .filter(s -> Boolean.TRUE.equals(s.getActive()))
                .orElseThrow(() -> new ServiceNotFoundException(name));
    }

    public List<MonitoredService> findActiveServices() {
        return serviceRepository.findActive();
    }

    public List<ServiceResponse> listServices(boolean includeInactive) {
        return serviceRepository.findAll(!includeInactive).stream()
                .map(s -> ServiceResponse.from(s, sloTargetRepository.findByServiceId(s.getServiceId(), false)))
                .collect(Collectors.toList());
    }

    public ServiceResponse getService(String name) {
        MonitoredService service = serviceRepository.findByName(name)
                .orElseThrow(() -> new ServiceNotFoundException(name));
        return ServiceResponse.from(service, sloTargetRepository.findByServiceId(service.getServiceId(), false));
    }

    /**
     * Targets are validated before anything is written, so a bad definition leaves
     * no half-registered service behind.
     */
    @Transactional
    public ServiceResponse createService(CreateServiceRequest request) {
        if (RESERVED_NAMES.contains(request.getName())) {
            throw new InvalidServiceRequestException("Service name '" + request.getName() + "' is reserved");
        }
        if (serviceRepository.findByName(request.getName()).isPresent()) {
            throw new DuplicateServiceException(request.getName());
        }

        List<SloTargetRequest> targetRequests = request.getSloTargets() != null
                ? request.getSloTargets() : List.of();
        List<SloTarget> targets = new ArrayList<>();
        for (SloTargetRequest targetRequest : targetRequests) {
            targets.add(definitions.newTarget(null, targetRequest));
        }

        MonitoredService service = MonitoredService.builder()
                .name(request.getName())
                .description(request.getDescription())
                .ownerTeam(request.getOwnerTeam())
                .tier(request.getTier() != null ? request.getTier() : 2)
                .active(true)
                .build();

        try {
            service = serviceRepository.save(service);
        } catch (DuplicateKeyException e) {
            throw new DuplicateServiceException(request.getName());
        }

        if (targets.isEmpty()) {
            targets.add(definitions.defaultTarget(service.getServiceId()));
        }

        List<SloTarget> saved = new ArrayList<>();
        for (SloTarget target : targets) {
            target.setServiceId(service.getServiceId());
            saved.add(sloTargetRepository.save(target));
        }

        log.info("Registered service {} (tier {}) with {} SLO target(s)",
                service.getName(), service.getTier(), saved.size());
        return ServiceResponse.from(service, saved);
    }

    @Transactional
    @CacheEvict(value = RedisCacheConfig.SERVICES, key = "#name")
    public ServiceResponse updateService(String name, UpdateServiceRequest request) {
        MonitoredService service = serviceRepository.findByName(name)
                .orElseThrow(() -> new ServiceNotFoundException(name));

        if (request.getDescription() != null) {
            service.setDescription(request.getDescription());
        }
        if (request.getOwnerTeam() != null) {
            service.setOwnerTeam(request.getOwnerTeam());
        }
        if (request.getTier() != null) {
            service.setTier(request.getTier());
        }
        if (request.getActive() != null) {
            service.setActive(request.getActive());
        }

        serviceRepository.update(service);
        log.info("Updated service {}", name);
        return ServiceResponse.from(service, sloTargetRepository.findByServiceId(service.getServiceId(), false));
    }

    @Transactional
    @CacheEvict(value = RedisCacheConfig.SERVICES, key = "#name")
    public void deactivateService(String name) {
        MonitoredService service = serviceRepository.findByName(name)
                .orElseThrow(() -> new ServiceNotFoundException(name));

        service.setActive(false);
        serviceRepository.update(service);
        snapshotCache.evictService(service.getServiceId());

        log.info("Deactivated service {}", name);
    }
}
