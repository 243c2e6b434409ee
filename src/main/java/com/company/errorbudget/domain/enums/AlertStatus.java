package com.company.errorbudget.domain.enums;

/**
 * Delivery state of an alert towards the notification sink.
 */
public enum AlertStatus {
    PENDING("Alert is waiting to be delivered"),
    SENT("Alert has been delivered"),
    FAILED("Alert delivery failed");

    private final String description;

    AlertStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFinal() {
        return this == SENT;
    }

    public static AlertStatus fromString(String status) {
        if (status == null) {
            return PENDING;
        }
        try {
            return AlertStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
