package com.neolms.studygroups.exception;

/**
 * Thrown when the caller lacks the group role an operation requires.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
