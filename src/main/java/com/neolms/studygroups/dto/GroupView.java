package com.neolms.studygroups.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.neolms.studygroups.model.GroupCategory;
import com.neolms.studygroups.model.GroupMember;
import com.neolms.studygroups.model.GroupWithMembers;
import com.neolms.studygroups.model.MemberRole;
import com.neolms.studygroups.model.StudyGroup;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, viewer-relative view of a group with its members.
 *
 * memberCount, onlineCount, isMember, userRole and lastActivity are derived from the
 * embedded member list every time the view is built, so the copy helpers used for optimistic
 * updates keep them consistent.
 */
public class GroupView {

    private final String groupId;
    private final String name;
    private final String description;
    private final GroupCategory category;
    private final String color;
    private final String icon;
    private final String avatarUrl;
    private final String courseId;
    private final String courseName;
    private final boolean isPrivate;
    private final int maxMembers;
    private final String createdBy;
    private final Instant createdAt;
    private final Instant groupLastActivity;
    private final int unreadMessages;
    private final boolean pinned;
    private final List<GroupMemberDTO> members;
    private final String viewerId;

    // Derived
    private final int memberCount;
    private final int onlineCount;
    private final MemberRole userRole;
    private final Instant lastActivity;

    private GroupView(GroupView source, List<GroupMemberDTO> members, boolean pinned) {
        this(source.groupId, source.name, source.description, source.category, source.color, source.icon,
                source.avatarUrl, source.courseId, source.courseName, source.isPrivate, source.maxMembers,
                source.createdBy, source.createdAt, source.groupLastActivity, source.unreadMessages,
                pinned, members, source.viewerId);
    }

    private GroupView(String groupId, String name, String description, GroupCategory category, String color,
                      String icon, String avatarUrl, String courseId, String courseName, boolean isPrivate,
                      int maxMembers, String createdBy, Instant createdAt, Instant groupLastActivity,
                      int unreadMessages, boolean pinned, List<GroupMemberDTO> members, String viewerId) {
        this.groupId = groupId;
        this.name = name;
        this.description = description;
        this.category = category;
        this.color = color;
        this.icon = icon;
        this.avatarUrl = avatarUrl;
        this.courseId = courseId;
        this.courseName = courseName;
        this.isPrivate = isPrivate;
        this.maxMembers = maxMembers;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.groupLastActivity = groupLastActivity;
        this.unreadMessages = unreadMessages;
        this.pinned = pinned;
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
        this.viewerId = viewerId;

        this.memberCount = this.members.size();
        this.onlineCount = (int) this.members.stream().filter(GroupMemberDTO::isOnline).count();
        this.userRole = this.members.stream()
                .filter(m -> m.getUserId().equals(viewerId))
                .map(GroupMemberDTO::getRole)
                .findFirst()
                .orElse(null);
        this.lastActivity = this.members.stream()
                .map(GroupMemberDTO::getLastActive)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(groupLastActivity);
    }

    public static GroupView from(GroupWithMembers loaded, String viewerId) {
        StudyGroup group = loaded.getGroup();
        List<GroupMemberDTO> members = new ArrayList<>();
        for (GroupMember member : loaded.getMembers()) {
            members.add(GroupMemberDTO.from(member));
        }
        Instant groupActivity = group.getLastActivity() != null ? group.getLastActivity() : group.getUpdatedAt();
        return new GroupView(group.getGroupId(), group.getName(), group.getDescription(), group.getGroupCategory(),
                group.getColor(), group.getIcon(), group.getAvatarUrl(), group.getCourseId(), group.getCourseName(),
                group.isPrivate(), group.getMaxMembers(), group.getCreatedBy(), group.getCreatedAt(), groupActivity,
                group.getUnreadCount(), loaded.isPinned(), members, viewerId);
    }

    public GroupView withMemberAdded(GroupMemberDTO member) {
        List<GroupMemberDTO> updated = new ArrayList<>(members);
        updated.removeIf(m -> m.getUserId().equals(member.getUserId()));
        updated.add(member);
        return new GroupView(this, updated, pinned);
    }

    public GroupView withMemberRemoved(String userId) {
        List<GroupMemberDTO> updated = new ArrayList<>(members);
        updated.removeIf(m -> m.getUserId().equals(userId));
        return new GroupView(this, updated, pinned);
    }

    public GroupView withPinned(boolean pinned) {
        return new GroupView(this, members, pinned);
    }

    public GroupMemberDTO findMember(String userId) {
        return members.stream().filter(m -> m.getUserId().equals(userId)).findFirst().orElse(null);
    }

    @JsonIgnore
    public boolean isFull() {
        return memberCount >= maxMembers;
    }

    @JsonIgnore
    public boolean isVisibleToViewer() {
        return !isPrivate || isMember();
    }

    public String getGroupId() {
        return groupId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public GroupCategory getCategory() {
        return category;
    }

    public String getColor() {
        return color;
    }

    public String getIcon() {
        return icon;
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    public String getCourseId() {
        return courseId;
    }

    public String getCourseName() {
        return courseName;
    }

    @JsonProperty("isPrivate")
    public boolean isPrivate() {
        return isPrivate;
    }

    public int getMaxMembers() {
        return maxMembers;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getUnreadMessages() {
        return unreadMessages;
    }

    @JsonProperty("isPinned")
    public boolean isPinned() {
        return pinned;
    }

    public List<GroupMemberDTO> getMembers() {
        return members;
    }

    public int getMemberCount() {
        return memberCount;
    }

    public int getOnlineCount() {
        return onlineCount;
    }

    @JsonProperty("isMember")
    public boolean isMember() {
        return userRole != null;
    }

    public MemberRole getUserRole() {
        return userRole;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    @JsonIgnore
    public String getViewerId() {
        return viewerId;
    }
}
