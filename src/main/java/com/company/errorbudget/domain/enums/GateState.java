package com.company.errorbudget.domain.enums;

/**
 * Release gate states. A decision starts EVALUATING and ends ALLOWED or BLOCKED.
 */
public enum GateState {
    EVALUATING,
    ALLOWED,
    BLOCKED;

    public boolean isTerminal() {
        return this != EVALUATING;
    }
}
