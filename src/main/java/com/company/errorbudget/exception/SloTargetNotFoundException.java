package com.company.errorbudget.exception;

public class SloTargetNotFoundException extends RuntimeException {
    public SloTargetNotFoundException(Long targetId) {
        super("SLO target not found: " + targetId);
    }
}
