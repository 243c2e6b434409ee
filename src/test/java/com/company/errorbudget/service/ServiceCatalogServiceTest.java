package com.company.errorbudget.service;

import com.company.errorbudget.cache.RedisSnapshotCache;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.dto.request.CreateServiceRequest;
import com.company.errorbudget.dto.request.SloTargetRequest;
import com.company.errorbudget.dto.response.ServiceResponse;
import com.company.errorbudget.exception.DuplicateServiceException;
import com.company.errorbudget.exception.InvalidServiceRequestException;
import com.company.errorbudget.exception.InvalidSloTargetException;
import com.company.errorbudget.exception.ServiceNotFoundException;
import com.company.errorbudget.repository.MonitoredServiceRepository;
import com.company.errorbudget.repository.SloTargetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ServiceCatalogService")
class ServiceCatalogServiceTest {

    @Mock
    private MonitoredServiceRepository serviceRepository;
    @Mock
    private SloTargetRepository sloTargetRepository;
    @Mock
    private RedisSnapshotCache snapshotCache;

    private ServiceCatalogService catalog;

    @BeforeEach
    void setUp() {
        catalog = new ServiceCatalogService(serviceRepository, sloTargetRepository,
                new SloTargetDefinitions(), snapshotCache);
    }

    @Nested
    @DisplayName("createService")
    class CreateService {

        @BeforeEach
        void storage() {
            when(serviceRepository.findByName("checkout")).thenReturn(Optional.empty());
        }

        @Test
        @DisplayName("adds the default availability target when none is given")
        void defaultTarget() {
            when(serviceRepository.save(any(MonitoredService.class))).thenAnswer(invocation -> {
                MonitoredService service = invocation.getArgument(0);
                service.setServiceId(4L);
                return service;
            });
            when(sloTargetRepository.save(any(SloTarget.class))).thenAnswer(invocation -> invocation.getArgument(0));

            ServiceResponse response = catalog.createService(CreateServiceRequest.builder().name("checkout").build());

            assertThat(response.getServiceId()).isEqualTo(4L);
            assertThat(response.getTier()).isEqualTo(2);
            assertThat(response.getSloTargets()).singleElement().satisfies(target -> {
                assertThat(target.getName()).isEqualTo("availability");
                assertThat(target.getTargetValue()).isEqualTo(99.9);
                assertThat(target.getWindowDays()).isEqualTo(30);
                assertThat(target.getServiceId()).isEqualTo(4L);
            });
        }

        @Test
        @DisplayName("an invalid target leaves nothing registered")
        void invalidTarget() {
            CreateServiceRequest request = CreateServiceRequest.builder()
                    .name("checkout")
                    .sloTargets(List.of(SloTargetRequest.builder().targetValue(100.0).build()))
                    .build();

            assertThatThrownBy(() -> catalog.createService(request))
                    .isInstanceOf(InvalidSloTargetException.class);

            verify(serviceRepository, never()).save(any());
            verify(sloTargetRepository, never()).save(any());
        }
    }

    @Test
    @DisplayName("rejects a name that collides with a fixed route")
    void reservedName() {
        assertThatThrownBy(() -> catalog.createService(CreateServiceRequest.builder().name("statistics").build()))
                .isInstanceOf(InvalidServiceRequestException.class)
                .hasMessageContaining("reserved");

        verify(serviceRepository, never()).findByName(any());
        verify(serviceRepository, never()).save(any());
    }

    @Test
    @DisplayName("rejects a duplicate name")
    void duplicate() {
        when(serviceRepository.findByName("checkout"))
                .thenReturn(Optional.of(MonitoredService.builder().serviceId(1L).name("checkout").active(true).build()));

        assertThatThrownBy(() -> catalog.createService(CreateServiceRequest.builder().name("checkout").build()))
                .isInstanceOf(DuplicateServiceException.class);
    }

    @Test
    @DisplayName("inactive services are not found by the evaluation paths")
    void inactiveNotFound() {
        when(serviceRepository.findByName("legacy"))
                .thenReturn(Optional.of(MonitoredService.builder().serviceId(2L).name("legacy").active(false).build()));

        assertThatThrownBy(() -> catalog.requireService("legacy"))
                .isInstanceOf(ServiceNotFoundException.class);
    }

    @Test
    @DisplayName("deactivation drops cached snapshots")
    void deactivate() {
        MonitoredService service = MonitoredService.builder().serviceId(2L).name("legacy").active(true).build();
        when(serviceRepository.findByName("legacy")).thenReturn(Optional.of(service));

        catalog.deactivateService("legacy");

        assertThat(service.getActive()).isFalse();
        verify(serviceRepository).update(service);
        verify(snapshotCache).evictService(2L);
    }
}
