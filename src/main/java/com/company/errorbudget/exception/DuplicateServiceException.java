package com.company.errorbudget.exception;

public class DuplicateServiceException extends RuntimeException {
    public DuplicateServiceException(String serviceName) {
        super("Service already registered: " + serviceName);
    }
}
