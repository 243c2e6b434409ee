package com.company.errorbudget.exception;

public class InvalidServiceRequestException extends RuntimeException {
    public InvalidServiceRequestException(String message) {
        super(message);
    }
}
