package com.company.errorbudget.domain.enums;

public enum AlertSeverity {
    INFO(1, "Informational"),
    WARNING(2, "Warning - budget burning faster than sustainable"),
    CRITICAL(3, "Critical - deployments blocked"),
    EMERGENCY(4, "Emergency - deployment freeze, immediate action required");

    private final int level;
    private final String description;

    AlertSeverity(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    public boolean isHigherThan(AlertSeverity other) {
        return this.level > other.level;
    }

    public boolean isAtLeast(AlertSeverity other) {
        return this.level >= other.level;
    }

    public static AlertSeverity fromString(String severity) {
        if (severity == null) {
            return WARNING;
        }
        try {
            return AlertSeverity.valueOf(severity.toUpperCase());
        } catch (IllegalArgumentException e) {
            return WARNING;
        }
    }
}
