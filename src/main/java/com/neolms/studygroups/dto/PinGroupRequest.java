package com.neolms.studygroups.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PinGroupRequest {

    @NotNull(message = "pinned is required")
    private Boolean pinned;

    public PinGroupRequest() {}

    public PinGroupRequest(Boolean pinned) {
        this.pinned = pinned;
    }
}
