package com.company.errorbudget.exception;

public class InvalidSloTargetException extends RuntimeException {
    public InvalidSloTargetException(String message) {
        super(message);
    }
}
