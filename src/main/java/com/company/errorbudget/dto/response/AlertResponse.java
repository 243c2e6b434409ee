package com.company.errorbudget.dto.response;

import com.company.errorbudget.domain.Alert;
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
public class AlertResponse {
    private Long alertId;
    private String serviceName;
    private AlertCategory category;
    private AlertSeverity severity;
    private RiskLevel riskLevel;
    private String title;
    private String message;
    private Instant createdAt;
    private boolean acknowledged;
    private String acknowledgedBy;
    private Instant acknowledgedAt;
    private AlertStatus deliveryStatus;

    public static AlertResponse from(Alert alert) {
        return AlertResponse.builder()
                .alertId(alert.getAlertId())
                .serviceName(alert.getServiceName())
                .category(alert.getCategory())
                .severity(alert.getSeverity())
                .riskLevel(alert.getRiskLevel())
                .title(alert.getTitle())
                .message(alert.getMessage())
                .createdAt(alert.getCreatedAt())
                .acknowledged(alert.isAcknowledged())
                .acknowledgedBy(alert.getAcknowledgedBy())
                .acknowledgedAt(alert.getAcknowledgedAt())
                .deliveryStatus(alert.getDeliveryStatus())
                .build();
    }
}
