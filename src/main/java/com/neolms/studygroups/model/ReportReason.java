package com.neolms.studygroups.model;

import java.util.Locale;

/**
 * Why a group was reported to moderators.
 */
public enum ReportReason {
    SPAM,
    HARASSMENT,
    INAPPROPRIATE,
    CHEATING,
    OTHER;

    /**
     * @throws IllegalArgumentException when the value is blank or names no reason
     */
    public static ReportReason fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Report reason is required");
        }
        return ReportReason.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
