package com.neolms.studygroups.exception;

/**
 * Raised by the repository when a group's member count has reached its maximum.
 */
public class CapacityExceededException extends RuntimeException {

    public CapacityExceededException(String message) {
        super(message);
    }

    public CapacityExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
