package com.company.errorbudget.exception;

/**
 * Caller input error on a release check. No decision is produced.
 */
public class InvalidReleaseRequestException extends RuntimeException {
    public InvalidReleaseRequestException(String message) {
        super(message);
    }
}
