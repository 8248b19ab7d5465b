package com.neolms.studygroups.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ReportGroupRequest {

    @NotBlank(message = "reason is required")
    private String reason;

    @Size(max = 1000, message = "details must be at most 1000 characters")
    private String details;

    public ReportGroupRequest() {}

    public ReportGroupRequest(String reason, String details) {
        this.reason = reason;
        this.details = details;
    }
}
