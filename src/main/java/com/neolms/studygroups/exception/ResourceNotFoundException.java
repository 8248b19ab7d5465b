package com.neolms.studygroups.exception;

/**
 * Thrown when a group or invite addressed by id does not exist or is not visible to the caller.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
