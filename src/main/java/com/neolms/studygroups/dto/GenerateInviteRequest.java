package com.neolms.studygroups.dto;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Optional limits for a new invite. Absent values mean "never expires" and "unlimited uses".
 */
@Data
public class GenerateInviteRequest {

    @Min(value = 1, message = "expiresInDays must be at least 1")
    private Integer expiresInDays;

    @Min(value = 1, message = "maxUses must be at least 1")
    private Integer maxUses;

    public GenerateInviteRequest() {}

    public GenerateInviteRequest(Integer expiresInDays, Integer maxUses) {
        this.expiresInDays = expiresInDays;
        this.maxUses = maxUses;
    }
}
