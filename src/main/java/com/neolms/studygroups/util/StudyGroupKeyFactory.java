package com.neolms.studygroups.util;

import com.neolms.studygroups.exception.InvalidKeyException;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Key factory for the single-table layout of study groups.
 *
 * <pre>
 * Group       GROUP#{groupId}       / METADATA           gsi2: DIRECTORY / GROUP#{groupId}
 * Member      GROUP#{groupId}       / USER#{userId}      gsi1: USER#{userId} / GROUP#{groupId}
 * Pin         USER#{userId}         / PIN#{groupId}
 * Invite      INVITE#{inviteId}     / METADATA           gsi1: GROUP#{groupId} / CREATED#{millis}, gsi3: CODE#{code}
 * Report      REPORT#{reportId}     / METADATA           gsi1: GROUP#{groupId} / REPORT#{millis}
 * </pre>
 */
public final class StudyGroupKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
        Pattern.CASE_INSENSITIVE
    );

    public static final String GROUP_PREFIX = "GROUP";
    public static final String USER_PREFIX = "USER";
    public static final String PIN_PREFIX = "PIN";
    public static final String INVITE_PREFIX = "INVITE";
    public static final String CODE_PREFIX = "CODE";
    public static final String REPORT_PREFIX = "REPORT";
    public static final String CREATED_PREFIX = "CREATED";
    public static final String METADATA_SUFFIX = "METADATA";
    public static final String DIRECTORY_PK = "DIRECTORY";

    public static final String USER_GROUP_INDEX = "UserGroupIndex";
    public static final String DIRECTORY_INDEX = "DirectoryIndex";
    public static final String INVITE_CODE_INDEX = "InviteCodeIndex";

    private StudyGroupKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    public static String getGroupPk(String groupId) {
        validateId(groupId, "Group");
        return GROUP_PREFIX + DELIMITER + groupId;
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }

    public static String getUserSk(String userId) {
        validateId(userId, "User");
        return USER_PREFIX + DELIMITER + userId;
    }

    public static String getUserPk(String userId) {
        validateId(userId, "User");
        return USER_PREFIX + DELIMITER + userId;
    }

    public static String getPinSk(String groupId) {
        validateId(groupId, "Group");
        return PIN_PREFIX + DELIMITER + groupId;
    }

    public static String getUserGsi1Pk(String userId) {
        validateId(userId, "User");
        return USER_PREFIX + DELIMITER + userId;
    }

    public static String getGroupGsi1Sk(String groupId) {
        validateId(groupId, "Group");
        return GROUP_PREFIX + DELIMITER + groupId;
    }

    public static String getGroupGsi1Pk(String groupId) {
        validateId(groupId, "Group");
        return GROUP_PREFIX + DELIMITER + groupId;
    }

    public static String getCreatedGsi1Sk(Instant createdAt) {
        return CREATED_PREFIX + DELIMITER + createdAt.toEpochMilli();
    }

    public static String getDirectoryGsi2Sk(String groupId) {
        validateId(groupId, "Group");
        return GROUP_PREFIX + DELIMITER + groupId;
    }

    public static String getInvitePk(String inviteId) {
        validateId(inviteId, "Invite");
        return INVITE_PREFIX + DELIMITER + inviteId;
    }

    public static String getReportPk(String reportId) {
        validateId(reportId, "Report");
        return REPORT_PREFIX + DELIMITER + reportId;
    }

    public static String getReportGsi1Sk(Instant createdAt) {
        return REPORT_PREFIX + DELIMITER + createdAt.toEpochMilli();
    }

    public static String getReportSkPrefix() {
        return REPORT_PREFIX + DELIMITER;
    }

    public static String getCodeGsi3Pk(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidKeyException("Invite code cannot be null or empty");
        }
        return CODE_PREFIX + DELIMITER + code;
    }

    public static String getUserSkPrefix() {
        return USER_PREFIX + DELIMITER;
    }

    public static String getPinSkPrefix() {
        return PIN_PREFIX + DELIMITER;
    }

    public static String getCreatedSkPrefix() {
        return CREATED_PREFIX + DELIMITER;
    }

    public static boolean isMemberItem(String sortKey) {
        return sortKey != null && sortKey.startsWith(USER_PREFIX + DELIMITER);
    }

    public static boolean isGroupMetadata(String sortKey) {
        return METADATA_SUFFIX.equals(sortKey);
    }

    /**
     * Pulls the id out of a prefixed key such as {@code PIN#1234}.
     */
    public static String extractId(String key) {
        if (key == null) {
            return null;
        }
        int idx = key.indexOf(DELIMITER);
        return idx < 0 ? key : key.substring(idx + 1);
    }

    public static boolean isValidId(String id) {
        return id != null && UUID_PATTERN.matcher(id).matches();
    }
}
