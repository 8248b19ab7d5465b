package com.neolms.studygroups.service;

import com.neolms.studygroups.dto.GroupInviteDTO;
import com.neolms.studygroups.dto.InviteLinkResponse;
import com.neolms.studygroups.model.Viewer;

import java.util.List;

public interface InviteService {

    /**
     * Create an invite for a group the viewer belongs to.
     *
     * @param expiresInDays days until the invite expires, or null for never
     * @param maxUses number of redemptions allowed, or null for unlimited
     */
    InviteLinkResponse generate(String groupId, Integer expiresInDays, Integer maxUses, Viewer viewer);

    /**
     * Consume one use of the invite and join its group.
     */
    MembershipResult redeem(String code, Viewer viewer);

    /**
     * Active invites of a group, newest first.
     */
    List<GroupInviteDTO> listActiveInvites(String groupId, Viewer viewer);

    void deactivate(String groupId, String inviteId, Viewer viewer);

    String buildLink(String code);
}
