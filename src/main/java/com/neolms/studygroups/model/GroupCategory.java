package com.neolms.studygroups.model;

import java.util.Locale;

/**
 * Fixed set of study group categories.
 */
public enum GroupCategory {
    STUDY,
    PROJECT,
    REVIEW,
    DISCUSSION;

    /**
     * Lenient parse used for request input; accepts any casing.
     *
     * @return the category, or null when the value is null or blank
     * @throws IllegalArgumentException when the value names no category
     */
    public static GroupCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return GroupCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
