package com.neolms.studygroups.dto;

import com.neolms.studygroups.model.GroupInvite;
import lombok.Data;

import java.time.Instant;

/**
 * Invite as listed to group members.
 */
@Data
public class GroupInviteDTO {

    private String inviteId;
    private String code;
    private String link;
    private String createdBy;
    private Instant createdAt;
    private Instant expiresAt;
    private Integer maxUses;
    private int useCount;
    private boolean active;

    public GroupInviteDTO() {}

    public GroupInviteDTO(GroupInvite invite, String link) {
        this.inviteId = invite.getInviteId();
        this.code = invite.getCode();
        this.link = link;
        this.createdBy = invite.getCreatedBy();
        this.createdAt = invite.getCreatedAt();
        this.expiresAt = invite.getExpiresAt();
        this.maxUses = invite.getMaxUses();
        this.useCount = invite.getUseCount();
        this.active = invite.isActive();
    }
}
