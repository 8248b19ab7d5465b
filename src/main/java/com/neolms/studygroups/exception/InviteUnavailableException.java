package com.neolms.studygroups.exception;

/**
 * Raised by the invite repository when the conditional use-count increment
 * fails. The reason is resolved by re-reading the invite after the failed write.
 */
public class InviteUnavailableException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        EXPIRED,
        EXHAUSTED
    }

    private final Reason reason;

    public InviteUnavailableException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InviteUnavailableException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
