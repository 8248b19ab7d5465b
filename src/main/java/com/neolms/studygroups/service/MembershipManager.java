package com.neolms.studygroups.service;

import com.neolms.studygroups.dto.CreateGroupRequest;
import com.neolms.studygroups.dto.GroupMemberDTO;
import com.neolms.studygroups.model.Viewer;

import java.util.List;

/**
 * Join, leave, create and pin operations against the group store.
 *
 * Policy failures come back as {@link MembershipResult} statuses. Invalid input throws
 * {@link com.neolms.studygroups.exception.ValidationException} before any store call, and
 * store failures propagate as {@link com.neolms.studygroups.exception.RepositoryException}.
 */
public interface MembershipManager {

    MembershipResult join(String groupId, Viewer viewer);

    /**
     * Leave a group. An owner hands ownership to the highest-ranked, longest-standing
     * remaining member; an owner who is the last member cannot leave.
     */
    MembershipResult leave(String groupId, Viewer viewer);

    MembershipResult create(CreateGroupRequest draft, Viewer viewer);

    MembershipResult togglePin(String groupId, boolean pinned, Viewer viewer);

    /**
     * Members ordered by role, then join time.
     */
    List<GroupMemberDTO> getMembers(String groupId, Viewer viewer);
}
