package com.company.errorbudget.service;

import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.dto.request.SloTargetRequest;
import com.company.errorbudget.exception.InvalidSloTargetException;
import org.springframework.stereotype.Component;

/**
 * Defaults and validation rules of SLO target definitions.
 */
@Component
public class SloTargetDefinitions {

    public static final double DEFAULT_TARGET_VALUE = 99.9;
    public static final int DEFAULT_WINDOW_DAYS = 30;
    public static final double DEFAULT_BURN_RATE_THRESHOLD = 1.0;
    public static final double DEFAULT_CRITICAL_BURN_RATE = 2.0;

    /**
     * Builds and validates a target from a request, filling defaults.
     */
    public SloTarget newTarget(Long serviceId, SloTargetRequest request) {
        SloTarget target = SloTarget.builder()
                .serviceId(serviceId)
                .name(request.getName() != null && !request.getName().isBlank()
                        ? request.getName().trim() : SloTarget.AVAILABILITY)
                .targetValue(request.getTargetValue())
                .windowDays(request.getWindowDays() != null ? request.getWindowDays() : DEFAULT_WINDOW_DAYS)
                .burnRateThreshold(request.getBurnRateThreshold() != null
                        ? request.getBurnRateThreshold() : DEFAULT_BURN_RATE_THRESHOLD)
                .criticalBurnRate(request.getCriticalBurnRate() != null
                        ? request.getCriticalBurnRate() : DEFAULT_CRITICAL_BURN_RATE)
                .active(request.getActive() != null ? request.getActive() : Boolean.TRUE)
                .build();

        validate(target);
        return target;
    }

    public SloTarget defaultTarget(Long serviceId) {
        return SloTarget.builder()
                .serviceId(serviceId)
                .name(SloTarget.AVAILABILITY)
                .targetValue(DEFAULT_TARGET_VALUE)
                .windowDays(DEFAULT_WINDOW_DAYS)
                .burnRateThreshold(DEFAULT_BURN_RATE_THRESHOLD)
                .criticalBurnRate(DEFAULT_CRITICAL_BURN_RATE)
                .active(true)
                .build();
    }

    public void validate(SloTarget target) {
        Double value = target.getTargetValue();
        if (value == null || value.isNaN() || value <= 0.0 || value >= 100.0) {
            throw new InvalidSloTargetException("target_value must be greater than 0 and less than 100");
        }
        if (target.getWindowDays() == null || target.getWindowDays() <= 0) {
            throw new InvalidSloTargetException("window_days must be greater than 0");
        }
        if (target.getBurnRateThreshold() == null || target.getBurnRateThreshold() <= 0.0) {
            throw new InvalidSloTargetException("burn_rate_threshold must be greater than 0");
        }
        if (target.getCriticalBurnRate() == null || target.getCriticalBurnRate() <= target.getBurnRateThreshold()) {
            throw new InvalidSloTargetException("critical_burn_rate must be greater than burn_rate_threshold");
        }
        if (target.getName() == null || target.getName().isBlank()) {
            throw new InvalidSloTargetException("name must not be blank");
        }
    }
}
