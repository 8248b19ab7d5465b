package com.neolms.studygroups.dto;

import lombok.Data;

import java.time.Instant;

/**
 * Response DTO for invite generation.
 * Contains the opaque code and the shareable join link.
 */
@Data
public class InviteLinkResponse {

    private String inviteId;
    private String code;
    private String link;
    private Instant expiresAt;
    private Integer maxUses;

    public InviteLinkResponse() {}

    public InviteLinkResponse(String inviteId, String code, String link, Instant expiresAt, Integer maxUses) {
        this.inviteId = inviteId;
        this.code = code;
        this.link = link;
        this.expiresAt = expiresAt;
        this.maxUses = maxUses;
    }
}
