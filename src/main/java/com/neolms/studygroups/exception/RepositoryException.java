package com.neolms.studygroups.exception;

/**
 * Exception thrown when a DynamoDB call fails for a non-policy reason.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
