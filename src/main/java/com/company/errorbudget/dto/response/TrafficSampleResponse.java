package com.company.errorbudget.dto.response;

import com.company.errorbudget.domain.TrafficSample;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrafficSampleResponse {
    private Instant timestamp;
    private long totalRequests;
    private long successCount;
    private long errorCount;
    private double errorRate;

    public static TrafficSampleResponse from(TrafficSample sample) {
        long total = sample.getTotalRequests();
        return TrafficSampleResponse.builder()
                .timestamp(sample.getTimestamp())
                .totalRequests(total)
                .successCount(sample.getSuccessCount())
                .errorCount(sample.getErrorCount())
                .errorRate(total > 0 ? (double) sample.getErrorCount() / total : 0.0)
                .build();
    }
}
