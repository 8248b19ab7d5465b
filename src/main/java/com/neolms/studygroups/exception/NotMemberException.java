package com.neolms.studygroups.exception;

/**
 * Raised by the repository when the member row to remove does not exist.
 */
public class NotMemberException extends RuntimeException {

    public NotMemberException(String message) {
        super(message);
    }

    public NotMemberException(String message, Throwable cause) {
        super(message, cause);
    }
}
