package com.company.errorbudget.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Caller inputs of one release gate check.
 */
@Value
@Builder
public class ReleaseCheckCommand {
    String serviceName;
    String deploymentId;
    String version;
    String requestedBy;
    boolean override;
    String overrideReason;

    public boolean hasOverrideReason() {
        return overrideReason != null && !overrideReason.isBlank();
    }
}
