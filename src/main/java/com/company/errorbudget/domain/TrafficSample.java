package com.company.errorbudget.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request outcomes observed for one service in one time bucket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrafficSample {
    private Long sampleId;
    private Long serviceId;
    private Instant timestamp;
    private long successCount;
    private long errorCount;

    public long getTotalRequests() {
        return successCount + errorCount;
    }
}
