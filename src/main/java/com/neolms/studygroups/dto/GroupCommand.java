package com.neolms.studygroups.dto;

import lombok.Data;

/**
 * Payload of the STOMP group commands. Each command reads only the fields it needs.
 */
@Data
public class GroupCommand {

    private String groupId;
    private Boolean pinned;
    private String code;
    private Integer expiresInDays;
    private Integer maxUses;

    public GroupCommand() {}

    public GroupCommand(String groupId) {
        this.groupId = groupId;
    }
}
