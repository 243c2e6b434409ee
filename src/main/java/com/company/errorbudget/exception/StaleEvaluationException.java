package com.company.errorbudget.exception;

/**
 * Thrown when a tick has been superseded by a newer one for the same service.
 * Its results are discarded.
 */
public class StaleEvaluationException extends RuntimeException {
    public StaleEvaluationException(Long serviceId, long generation) {
        super("Evaluation tick " + generation + " for service " + serviceId + " was superseded");
    }
}
