package com.company.errorbudget.domain;

import com.company.errorbudget.domain.enums.AlertCategory;
import com.company.errorbudget.domain.enums.AlertSeverity;
import com.company.errorbudget.domain.enums.AlertStatus;
import com.company.errorbudget.domain.enums.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    private Long alertId;
    private Long serviceId;
    private String serviceName;
    private Long sloTargetId;
    private AlertCategory category;
    private AlertSeverity severity;
    private RiskLevel riskLevel;
    private String title;
    private String message;
    private Instant createdAt;

    private boolean acknowledged;
    private String acknowledgedBy;
    private Instant acknowledgedAt;

    // Notification delivery
    private AlertStatus deliveryStatus;
    private Instant deliveredAt;
    private Integer retryCount;
    private String lastError;
}
