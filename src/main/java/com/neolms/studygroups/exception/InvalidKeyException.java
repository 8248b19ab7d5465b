package com.neolms.studygroups.exception;

/**
 * Thrown when a DynamoDB key cannot be built from the supplied id.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }

    public InvalidKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
