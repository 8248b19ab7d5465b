package com.neolms.studygroups.model;

import com.neolms.studygroups.util.StudyGroupKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * A member's report of a group to teachers and moderators.
 *
 * DynamoDB Keys:
 *   PK: REPORT#{reportId}
 *   SK: METADATA
 *
 * GSI (UserGroupIndex) for listing reports of a group:
 *   gsi1pk: GROUP#{groupId}
 *   gsi1sk: REPORT#{createdAt}
 *
 * The group name and reporter name are copied in so a report stays readable after
 * the group is renamed or deleted.
 */
@DynamoDbBean
public class GroupReport extends BaseItem {

    public static final String ITEM_TYPE = "GROUP_REPORT";

    private String reportId;
    private String groupId;
    private String groupName;
    private String reporterId;
    private String reporterName;
    private String reason;
    private String details;
    private String status;

    public GroupReport() {
        super();
        setItemType(ITEM_TYPE);
    }

    public GroupReport(String groupId, String groupName, Viewer reporter, ReportReason reason, String details,
                       Instant createdAt) {
        super();
        setItemType(ITEM_TYPE);
        this.reportId = UUID.randomUUID().toString();
        this.groupId = groupId;
        this.groupName = groupName;
        this.reporterId = reporter.getUserId();
        this.reporterName = reporter.getDisplayName();
        this.reason = reason.name();
        this.details = details;
        this.status = ReportStatus.PENDING.name();
        setCreatedAt(createdAt);
        setUpdatedAt(createdAt);

        setPk(StudyGroupKeyFactory.getReportPk(reportId));
        setSk(StudyGroupKeyFactory.getMetadataSk());
        setGsi1pk(StudyGroupKeyFactory.getGroupGsi1Pk(groupId));
        setGsi1sk(StudyGroupKeyFactory.getReportGsi1Sk(createdAt));
    }

    public String getReportId() {
        return reportId;
    }

    public void setReportId(String reportId) {
        this.reportId = reportId;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getGroupName() {
        return groupName;
    }

    public void setGroupName(String groupName) {
        this.groupName = groupName;
    }

    public String getReporterId() {
        return reporterId;
    }

    public void setReporterId(String reporterId) {
        this.reporterId = reporterId;
    }

    public String getReporterName() {
        return reporterName;
    }

    public void setReporterName(String reporterName) {
        this.reporterName = reporterName;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    @DynamoDbIgnore
    public ReportReason getReportReason() {
        return ReportReason.valueOf(reason);
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    @DynamoDbIgnore
    public ReportStatus getReportStatus() {
        return status == null ? ReportStatus.PENDING : ReportStatus.valueOf(status);
    }
}
