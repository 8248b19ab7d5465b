package com.neolms.studygroups.repository;

import com.neolms.studygroups.model.GroupInvite;
import com.neolms.studygroups.model.GroupMember;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for group invites.
 * Handles persistence and lookup of invites and the atomic redemption write.
 */
public interface GroupInviteRepository {

    /**
     * Save a new invite. Fails if the invite id already exists.
     */
    void save(GroupInvite invite);

    /**
     * Find an invite by its code string (InviteCodeIndex).
     */
    Optional<GroupInvite> findByCode(String code);

    Optional<GroupInvite> findById(String inviteId);

    /**
     * All invites for a group, newest first.
     */
    List<GroupInvite> findAllByGroupId(String groupId);

    boolean codeExists(String code);

    void deactivate(String inviteId, String deactivatedBy, Instant at);

    /**
     * Consumes one use of the invite and adds the member to the invite's group in a single
     * transaction. The use count never passes maxUses, even under concurrent redeemers.
     *
     * @throws com.neolms.studygroups.exception.InviteUnavailableException when the invite is
     *         deactivated, expired or used up at write time
     * @throws com.neolms.studygroups.exception.AlreadyMemberException when the member row exists
     * @throws com.neolms.studygroups.exception.CapacityExceededException when the group is full
     */
    void redeem(GroupInvite invite, GroupMember member, Instant now);
}
