package com.company.errorbudget.service;

import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.dto.request.SloTargetRequest;
import com.company.errorbudget.exception.InvalidSloTargetException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SloTargetDefinitions")
class SloTargetDefinitionsTest {

    private final SloTargetDefinitions definitions = new SloTargetDefinitions();

    @Test
    @DisplayName("fills defaults for omitted fields")
    void defaults() {
        SloTarget target = definitions.newTarget(1L, SloTargetRequest.builder().targetValue(99.5).build());

        assertThat(target.getName()).isEqualTo(SloTarget.AVAILABILITY);
        assertThat(target.getWindowDays()).isEqualTo(30);
        assertThat(target.getBurnRateThreshold()).isEqualTo(1.0);
        assertThat(target.getCriticalBurnRate()).isEqualTo(2.0);
        assertThat(target.getActive()).isTrue();
        assertThat(target.allowedErrorRate()).isEqualTo((100.0 - 99.5) / 100.0);
    }

    @ParameterizedTest(name = "target_value {0} is rejected")
    @ValueSource(doubles = {0.0, -1.0, 100.0, 100.5})
    @DisplayName("target value must lie strictly between 0 and 100")
    void targetValueRange(double value) {
        assertThatThrownBy(() -> definitions.newTarget(1L, SloTargetRequest.builder().targetValue(value).build()))
                .isInstanceOf(InvalidSloTargetException.class)
                .hasMessageContaining("target_value");
    }

    @Test
    @DisplayName("critical burn rate must exceed the observe threshold")
    void criticalAboveObserve() {
        SloTargetRequest request = SloTargetRequest.builder()
                .targetValue(99.9).burnRateThreshold(2.0).criticalBurnRate(2.0).build();

        assertThatThrownBy(() -> definitions.newTarget(1L, request))
                .isInstanceOf(InvalidSloTargetException.class)
                .hasMessageContaining("critical_burn_rate");
    }

    @Test
    @DisplayName("window must be positive")
    void windowDays() {
        SloTargetRequest request = SloTargetRequest.builder().targetValue(99.9).windowDays(0).build();

        assertThatThrownBy(() -> definitions.newTarget(1L, request))
                .isInstanceOf(InvalidSloTargetException.class)
                .hasMessageContaining("window_days");
    }

    @Test
    @DisplayName("default target is a valid 99.9% availability SLO")
    void defaultTarget() {
        SloTarget target = definitions.defaultTarget(7L);

        definitions.validate(target);
        assertThat(target.getServiceId()).isEqualTo(7L);
        assertThat(target.getTargetValue()).isEqualTo(99.9);
        assertThat(target.isAvailability()).isTrue();
    }
}
