package com.neolms.studygroups.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PresenceRequest {

    @NotNull(message = "online is required")
    private Boolean online;

    public PresenceRequest() {}

    public PresenceRequest(Boolean online) {
        this.online = online;
    }
}
