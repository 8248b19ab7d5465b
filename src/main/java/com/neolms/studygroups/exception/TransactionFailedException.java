package com.neolms.studygroups.exception;

/**
 * Exception thrown when a DynamoDB transaction is cancelled for a reason that is not a known conditional check.
 */
public class TransactionFailedException extends RuntimeException {

    public TransactionFailedException(String message) {
        super(message);
    }

    public TransactionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
