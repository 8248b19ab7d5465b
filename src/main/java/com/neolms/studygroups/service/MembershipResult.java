package com.neolms.studygroups.service;

import com.neolms.studygroups.dto.GroupView;

/**
 * Outcome of a membership operation. Policy failures are expected outcomes rendered
 * as user feedback, so they are carried here rather than thrown.
 */
public class MembershipResult {
    public enum Status {
        JOINED(true),
        LEFT(true),
        CREATED(true),
        PIN_UPDATED(true),
        CAPACITY_EXCEEDED(false),
        ALREADY_MEMBER(false),
        NOT_MEMBER(false),
        OWNER_CANNOT_LEAVE(false),
        GROUP_NOT_FOUND(false),
        INVITE_NOT_FOUND(false),
        INVITE_EXPIRED(false),
        INVITE_EXHAUSTED(false);

        private final boolean success;

        Status(boolean success) {
            this.success = success;
        }

        public boolean isSuccess() {
            return success;
        }
    }

    private final Status status;
    private final String groupId;
    private final GroupView group;
    private final String message;

    private MembershipResult(Status status, String groupId, GroupView group, String message) {
        this.status = status;
        this.groupId = groupId;
        this.group = group;
        this.message = message;
    }

    public static MembershipResult joined(GroupView group) {
        return new MembershipResult(Status.JOINED, group.getGroupId(), group, "Joined " + group.getName());
    }

    /**
     * @param group the group after leaving, or null when it is no longer visible to the former member
     */
    public static MembershipResult left(String groupId, GroupView group) {
        return new MembershipResult(Status.LEFT, groupId, group, "You left the group");
    }

    public static MembershipResult created(GroupView group) {
        return new MembershipResult(Status.CREATED, group.getGroupId(), group, "Group created");
    }

    public static MembershipResult pinUpdated(GroupView group) {
        return new MembershipResult(Status.PIN_UPDATED, group.getGroupId(), group,
                group.isPinned() ? "Group pinned" : "Group unpinned");
    }

    public static MembershipResult capacityExceeded(String groupId) {
        return new MembershipResult(Status.CAPACITY_EXCEEDED, groupId, null, "This group is full");
    }

    public static MembershipResult alreadyMember(String groupId) {
        return new MembershipResult(Status.ALREADY_MEMBER, groupId, null, "You are already a member of this group");
    }

    public static MembershipResult notMember(String groupId) {
        return new MembershipResult(Status.NOT_MEMBER, groupId, null, "You are not a member of this group");
    }

    public static MembershipResult ownerCannotLeave(String groupId) {
        return new MembershipResult(Status.OWNER_CANNOT_LEAVE, groupId, null,
                "The owner cannot leave while no other member can take over");
    }

    public static MembershipResult groupNotFound(String groupId) {
        return new MembershipResult(Status.GROUP_NOT_FOUND, groupId, null, "Group not found");
    }

    public static MembershipResult inviteNotFound() {
        return new MembershipResult(Status.INVITE_NOT_FOUND, null, null, "Invalid invite link");
    }

    public static MembershipResult inviteExpired(String groupId) {
        return new MembershipResult(Status.INVITE_EXPIRED, groupId, null, "This invite link has expired");
    }

    public static MembershipResult inviteExhausted(String groupId) {
        return new MembershipResult(Status.INVITE_EXHAUSTED, groupId, null,
                "This invite link has reached its usage limit");
    }

    public Status getStatus() {
        return status;
    }

    public String getGroupId() {
        return groupId;
    }

    public GroupView getGroup() {
        return group;
    }

    public String getMessage() {
        return message;
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }
}
