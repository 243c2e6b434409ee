package com.company.errorbudget.engine;

import lombok.Value;

/**
 * Traffic totals and error rate over one window. Error rate is 0 without traffic.
 */
@Value
public class WindowRate {
    public static final WindowRate EMPTY = new WindowRate(0L, 0L, 0.0);

    long totalRequests;
    long errorCount;
    double errorRate;

    public static WindowRate of(long totalRequests, long errorCount) {
        if (totalRequests <= 0) {
            return EMPTY;
        }
        return new WindowRate(totalRequests, errorCount, (double) errorCount / totalRequests);
    }

    public boolean hasTraffic() {
        return totalRequests > 0;
    }

    /**
     * Percentage of successful requests, or null without traffic.
     */
    public Double availability() {
        return hasTraffic() ? (1.0 - errorRate) * 100.0 : null;
    }
}
