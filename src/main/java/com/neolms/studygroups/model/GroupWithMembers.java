package com.neolms.studygroups.model;

import java.util.List;

/**
 * A group metadata item together with its member rows and the requesting viewer's pin flag,
 * as loaded from one group partition.
 */
public class GroupWithMembers {

    private final StudyGroup group;
    private final List<GroupMember> members;
    private final boolean pinned;

    public GroupWithMembers(StudyGroup group, List<GroupMember> members, boolean pinned) {
        this.group = group;
        this.members = List.copyOf(members);
        this.pinned = pinned;
    }

    public StudyGroup getGroup() {
        return group;
    }

    public List<GroupMember> getMembers() {
        return members;
    }

    public boolean isPinned() {
        return pinned;
    }

    public boolean hasMember(String userId) {
        return members.stream().anyMatch(m -> m.getUserId().equals(userId));
    }

    public boolean isVisibleTo(String viewerId) {
        return !group.isPrivate() || hasMember(viewerId);
    }
}
