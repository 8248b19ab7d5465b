package com.neolms.studygroups.model;

import com.neolms.studygroups.util.EpochMillisInstantConverter;
import com.neolms.studygroups.util.StudyGroupKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.time.Instant;

/**
 * A user's membership in a study group, with the display name and avatar
 * denormalized so member lists render from one partition query.
 *
 * Key Pattern: PK = GROUP#{GroupID}, SK = USER#{UserID}
 * GSI Pattern: GSI1PK = USER#{UserID}, GSI1SK = GROUP#{GroupID}
 */
@DynamoDbBean
public class GroupMember extends BaseItem {

    public static final String ITEM_TYPE = "GROUP_MEMBER";

    private String groupId;
    private String userId;
    private String displayName;
    private String avatarUrl;
    private String role;
    private boolean online;
    private Instant lastActive;

    // Default constructor for DynamoDB
    public GroupMember() {
        super();
        setItemType(ITEM_TYPE);
    }

    public GroupMember(String groupId, String userId, MemberRole role) {
        super();
        setItemType(ITEM_TYPE);
        this.groupId = groupId;
        this.userId = userId;
        this.role = role.name();
        this.lastActive = getCreatedAt();

        setPk(StudyGroupKeyFactory.getGroupPk(groupId));
        setSk(StudyGroupKeyFactory.getUserSk(userId));
        setGsi1pk(StudyGroupKeyFactory.getUserGsi1Pk(userId));
        setGsi1sk(StudyGroupKeyFactory.getGroupGsi1Sk(groupId));
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    public void setAvatarUrl(String avatarUrl) {
        this.avatarUrl = avatarUrl;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    @DynamoDbIgnore
    public MemberRole getMemberRole() {
        return role == null ? MemberRole.MEMBER : MemberRole.valueOf(role);
    }

    public boolean isOnline() {
        return online;
    }

    public void setOnline(boolean online) {
        this.online = online;
    }

    @DynamoDbConvertedBy(EpochMillisInstantConverter.class)
    public Instant getLastActive() {
        return lastActive;
    }

    public void setLastActive(Instant lastActive) {
        this.lastActive = lastActive;
    }

    @DynamoDbIgnore
    public Instant getJoinedAt() {
        return getCreatedAt();
    }

    @DynamoDbIgnore
    public boolean isOwner() {
        return getMemberRole() == MemberRole.OWNER;
    }
}
