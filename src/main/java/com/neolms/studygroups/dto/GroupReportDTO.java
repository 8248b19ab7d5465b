package com.neolms.studygroups.dto;

import com.neolms.studygroups.model.GroupReport;
import com.neolms.studygroups.model.ReportReason;
import com.neolms.studygroups.model.ReportStatus;
import lombok.Data;

import java.time.Instant;

/**
 * Receipt returned to the reporter.
 */
@Data
public class GroupReportDTO {

    private String reportId;
    private String groupId;
    private ReportReason reason;
    private ReportStatus status;
    private Instant createdAt;

    public GroupReportDTO() {}

    public GroupReportDTO(GroupReport report) {
        this.reportId = report.getReportId();
        this.groupId = report.getGroupId();
        this.reason = report.getReportReason();
        this.status = report.getReportStatus();
        this.createdAt = report.getCreatedAt();
    }
}
