package com.neolms.studygroups.model;

/**
 * Moderation state of a group report. New reports are always PENDING; the moderation
 * dashboard moves them on.
 */
public enum ReportStatus {
    PENDING,
    REVIEWING,
    RESOLVED,
    DISMISSED
}
