package com.neolms.studygroups.exception;

/**
 * Thrown when request input is rejected before any persistence call is made.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
