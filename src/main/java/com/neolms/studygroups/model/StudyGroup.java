package com.neolms.studygroups.model;

import com.neolms.studygroups.util.EpochMillisInstantConverter;
import com.neolms.studygroups.util.StudyGroupKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * Study group metadata item.
 *
 * Key Pattern: PK = GROUP#{GroupID}, SK = METADATA
 * Directory GSI: GSI2PK = DIRECTORY, GSI2SK = GROUP#{GroupID}
 *
 * memberCount is the atomic counter that conditional joins check against maxMembers.
 */
@DynamoDbBean
public class StudyGroup extends BaseItem {

    public static final String ITEM_TYPE = "GROUP";
    public static final String DEFAULT_COLOR = "#3b82f6";
    public static final String DEFAULT_ICON = "users";
    public static final int DEFAULT_MAX_MEMBERS = 10;

    private String groupId;
    private String name;
    private String description;
    private String category;
    private String color;
    private String icon;
    private String avatarUrl;
    private String courseId;
    private String courseName;
    private boolean isPrivate;
    private int maxMembers;
    private int memberCount;
    private String createdBy;
    private Instant lastActivity;
    private int unreadCount;

    // Default constructor for DynamoDB
    public StudyGroup() {
        super();
        setItemType(ITEM_TYPE);
    }

    public StudyGroup(String name, String createdBy, boolean isPrivate) {
        super();
        setItemType(ITEM_TYPE);
        this.groupId = UUID.randomUUID().toString();
        this.name = name;
        this.createdBy = createdBy;
        this.isPrivate = isPrivate;
        this.description = "";
        this.category = GroupCategory.STUDY.name();
        this.color = DEFAULT_COLOR;
        this.icon = DEFAULT_ICON;
        this.maxMembers = DEFAULT_MAX_MEMBERS;

        setPk(StudyGroupKeyFactory.getGroupPk(groupId));
        setSk(StudyGroupKeyFactory.getMetadataSk());
        setGsi2pk(StudyGroupKeyFactory.DIRECTORY_PK);
        setGsi2sk(StudyGroupKeyFactory.getDirectoryGsi2Sk(groupId));
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    @DynamoDbIgnore
    public GroupCategory getGroupCategory() {
        return category == null ? GroupCategory.STUDY : GroupCategory.valueOf(category);
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public String getIcon() {
        return icon;
    }

    public void setIcon(String icon) {
        this.icon = icon;
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    public void setAvatarUrl(String avatarUrl) {
        this.avatarUrl = avatarUrl;
    }

    public String getCourseId() {
        return courseId;
    }

    public void setCourseId(String courseId) {
        this.courseId = courseId;
    }

    public String getCourseName() {
        return courseName;
    }

    public void setCourseName(String courseName) {
        this.courseName = courseName;
    }

    public boolean isPrivate() {
        return isPrivate;
    }

    public void setPrivate(boolean isPrivate) {
        this.isPrivate = isPrivate;
    }

    public int getMaxMembers() {
        return maxMembers;
    }

    public void setMaxMembers(int maxMembers) {
        this.maxMembers = maxMembers;
    }

    public int getMemberCount() {
        return memberCount;
    }

    public void setMemberCount(int memberCount) {
        this.memberCount = memberCount;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    @DynamoDbConvertedBy(EpochMillisInstantConverter.class)
    public Instant getLastActivity() {
        return lastActivity;
    }

    public void setLastActivity(Instant lastActivity) {
        this.lastActivity = lastActivity;
    }

    public int getUnreadCount() {
        return unreadCount;
    }

    public void setUnreadCount(int unreadCount) {
        this.unreadCount = unreadCount;
    }

    @DynamoDbIgnore
    public boolean isFull() {
        return memberCount >= maxMembers;
    }
}
