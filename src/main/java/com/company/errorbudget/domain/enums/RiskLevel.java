package com.company.errorbudget.domain.enums;

import java.util.Optional;

/**
 * Discrete reliability risk derived from the composite burn rate.
 * Declaration order is significant: later constants are more severe.
 */
public enum RiskLevel {
    SAFE(0, "Normal operations"),
    OBSERVE(1, "Increased monitoring"),
    DANGER(2, "Limit non-critical changes"),
    FREEZE(3, "Block all deployments");

    private final int rank;
    private final String action;

    RiskLevel(int rank, String action) {
        this.rank = rank;
        this.action = action;
    }

    public int getRank() {
        return rank;
    }

    public String getAction() {
        return action;
    }

    public boolean isAtLeast(RiskLevel other) {
        return this.rank >= other.rank;
    }

    public boolean isHigherThan(RiskLevel other) {
        return this.rank > other.rank;
    }

    /**
     * DANGER and FREEZE block deployments unless overridden.
     */
    public boolean blocksRelease() {
        return switch (this) {
            case SAFE, OBSERVE -> false;
            case DANGER, FREEZE -> true;
        };
    }

    /**
     * Severity of the alert raised when a service enters this level; SAFE raises none.
     */
    public Optional<AlertSeverity> alertSeverity() {
        return switch (this) {
            case SAFE -> Optional.empty();
            case OBSERVE -> Optional.of(AlertSeverity.WARNING);
            case DANGER -> Optional.of(AlertSeverity.CRITICAL);
            case FREEZE -> Optional.of(AlertSeverity.EMERGENCY);
        };
    }

    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isHigherThan(b) ? a : b;
    }

    public static RiskLevel fromString(String level) {
        if (level == null) {
            return SAFE;
        }
        try {
            return RiskLevel.valueOf(level.toUpperCase());
        } catch (IllegalArgumentException e) {
            return SAFE;
        }
    }
}
