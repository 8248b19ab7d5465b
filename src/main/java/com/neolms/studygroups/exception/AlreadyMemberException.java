package com.neolms.studygroups.exception;

/**
 * Raised by the repository when a member row for the user already exists.
 */
public class AlreadyMemberException extends RuntimeException {

    public AlreadyMemberException(String message) {
        super(message);
    }

    public AlreadyMemberException(String message, Throwable cause) {
        super(message, cause);
    }
}
