package com.neolms.studygroups.util;

import com.neolms.studygroups.dto.CreateGroupRequest;
import com.neolms.studygroups.exception.ValidationException;
import com.neolms.studygroups.model.GroupCategory;
import com.neolms.studygroups.model.ReportReason;

import java.util.regex.Pattern;

/**
 * Input checks that run before any repository call.
 */
public final class StudyGroupValidator {

    public static final int MIN_NAME_LENGTH = 3;
    public static final int MAX_NAME_LENGTH = 50;
    public static final int MAX_DESCRIPTION_LENGTH = 200;
    public static final int MIN_MAX_MEMBERS = 5;
    public static final int MAX_MAX_MEMBERS = 50;
    public static final int MAX_INVITE_DAYS = 365;
    public static final int MAX_REPORT_DETAILS_LENGTH = 1000;

    private static final Pattern HEX_COLOR = Pattern.compile("#[0-9a-fA-F]{6}");

    private StudyGroupValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static void validateDraft(CreateGroupRequest draft) {
        if (draft == null) {
            throw new ValidationException("Group details are required");
        }
        String name = draft.getName();
        if (name == null || name.length() < MIN_NAME_LENGTH || name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Group name must be between " + MIN_NAME_LENGTH
                + " and " + MAX_NAME_LENGTH + " characters");
        }
        String description = draft.getDescription();
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        Integer maxMembers = draft.getMaxMembers();
        if (maxMembers != null && (maxMembers < MIN_MAX_MEMBERS || maxMembers > MAX_MAX_MEMBERS)) {
            throw new ValidationException("Maximum members must be between " + MIN_MAX_MEMBERS
                + " and " + MAX_MAX_MEMBERS);
        }
        try {
            GroupCategory.fromValue(draft.getCategory());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown category: " + draft.getCategory(), e);
        }
        if (draft.getColor() != null && !HEX_COLOR.matcher(draft.getColor()).matches()) {
            throw new ValidationException("Color must be a hex color such as #3b82f6");
        }
    }

    public static ReportReason validateReport(String reason, String details) {
        ReportReason parsed;
        try {
            parsed = ReportReason.fromValue(reason);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Report reason must be one of spam, harassment, inappropriate, "
                + "cheating or other", e);
        }
        if (details != null && details.length() > MAX_REPORT_DETAILS_LENGTH) {
            throw new ValidationException("Report details must be at most " + MAX_REPORT_DETAILS_LENGTH
                + " characters");
        }
        return parsed;
    }

    public static void validateInviteLimits(Integer expiresInDays, Integer maxUses) {
        if (expiresInDays != null && (expiresInDays < 1 || expiresInDays > MAX_INVITE_DAYS)) {
            throw new ValidationException("expiresInDays must be between 1 and " + MAX_INVITE_DAYS);
        }
        if (maxUses != null && maxUses < 1) {
            throw new ValidationException("maxUses must be at least 1");
        }
    }
}
