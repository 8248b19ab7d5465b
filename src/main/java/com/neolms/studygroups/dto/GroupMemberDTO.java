package com.neolms.studygroups.dto;

import com.neolms.studygroups.model.GroupMember;
import com.neolms.studygroups.model.MemberRole;
import com.neolms.studygroups.model.Viewer;

import java.time.Instant;

/**
 * Member entry embedded in a {@link GroupView}.
 */
public class GroupMemberDTO {

    private final String userId;
    private final String displayName;
    private final String avatarUrl;
    private final MemberRole role;
    private final boolean online;
    private final Instant lastActive;
    private final Instant joinedAt;

    public GroupMemberDTO(String userId, String displayName, String avatarUrl, MemberRole role,
                          boolean online, Instant lastActive, Instant joinedAt) {
        this.userId = userId;
        this.displayName = displayName;
        this.avatarUrl = avatarUrl;
        this.role = role;
        this.online = online;
        this.lastActive = lastActive;
        this.joinedAt = joinedAt;
    }

    public static GroupMemberDTO from(GroupMember member) {
        return new GroupMemberDTO(member.getUserId(), member.getDisplayName(), member.getAvatarUrl(),
                member.getMemberRole(), member.isOnline(), member.getLastActive(), member.getJoinedAt());
    }

    /**
     * Placeholder entry for a viewer who has just joined, used before the store confirms.
     */
    public static GroupMemberDTO pending(Viewer viewer, Instant now) {
        return new GroupMemberDTO(viewer.getUserId(), viewer.getDisplayName(), viewer.getAvatarUrl(),
                MemberRole.MEMBER, true, now, now);
    }

    public GroupMemberDTO withRole(MemberRole newRole) {
        return new GroupMemberDTO(userId, displayName, avatarUrl, newRole, online, lastActive, joinedAt);
    }

    public String getUserId() {
        return userId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    public MemberRole getRole() {
        return role;
    }

    public boolean isOnline() {
        return online;
    }

    public Instant getLastActive() {
        return lastActive;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }
}
