package com.company.errorbudget.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cumulative budget consumption of one (service, SLO) pair within its current
 * compliance window, in error-rate-hours.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ErrorBudgetLedgerEntry {
    private Long serviceId;
    private Long sloTargetId;
    private Instant windowStart;
    private Instant windowEnd;
    private double consumedErrorHours;
    private Instant lastAccruedAt;
    private Long lastSampleId;   // highest traffic sample id already accrued
    private Long version;   // null until first persisted
    private Instant updatedAt;
}
