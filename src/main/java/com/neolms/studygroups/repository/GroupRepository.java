package com.neolms.studygroups.repository;

import com.neolms.studygroups.model.GroupMember;
import com.neolms.studygroups.model.GroupWithMembers;
import com.neolms.studygroups.model.StudyGroup;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for groups, members, pins and presence.
 *
 * Conditional writes are the only hard consistency guarantee: capacity and duplicate
 * membership are enforced here, and reported as
 * {@link com.neolms.studygroups.exception.CapacityExceededException},
 * {@link com.neolms.studygroups.exception.AlreadyMemberException} and
 * {@link com.neolms.studygroups.exception.NotMemberException}.
 */
public interface GroupRepository {

    /**
     * All groups the viewer can see (public ones and private ones they belong to),
     * each with its member rows and the viewer's pin flag.
     */
    List<GroupWithMembers> list(String viewerId);

    Optional<GroupWithMembers> findGroup(String groupId, String viewerId);

    Optional<GroupMember> findMember(String groupId, String userId);

    List<GroupMember> findMembers(String groupId);

    /**
     * Membership rows of one user across all groups (UserGroupIndex).
     */
    List<GroupMember> findMembershipsByUser(String userId);

    /**
     * Writes the group and its owner in one transaction.
     */
    void insertGroupWithOwner(StudyGroup group, GroupMember owner);

    /**
     * Puts the member and increments memberCount, conditioned on capacity, in one transaction.
     */
    void insertMember(GroupMember member);

    /**
     * Deletes the member and decrements memberCount in one transaction, promoting
     * the successor to owner in the same write when one is given.
     *
     * @param successorUserId member to promote, or null
     * @param at             stamped as updatedAt on the touched rows
     */
    void deleteMember(String groupId, String userId, String successorUserId, Instant at);

    /**
     * Idempotent per-viewer pin.
     */
    void setPinned(String viewerId, String groupId, boolean pinned);

    /**
     * Updates online flag and last-active time of an existing member row.
     *
     * @return false when the row no longer exists
     */
    boolean updateMemberPresence(String groupId, String userId, boolean online, Instant at);
}
