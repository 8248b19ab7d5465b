package com.neolms.studygroups.repository.impl;

import com.neolms.studygroups.config.StudyGroupsProperties;
import com.neolms.studygroups.exception.RepositoryException;
import com.neolms.studygroups.model.GroupReport;
import com.neolms.studygroups.repository.GroupReportRepository;
import com.neolms.studygroups.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

@Repository
public class GroupReportRepositoryImpl implements GroupReportRepository {

    private static final Logger logger = LoggerFactory.getLogger(GroupReportRepositoryImpl.class);

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;
    private final String tableName;
    private final TableSchema<GroupReport> reportSchema;

    @Autowired
    public GroupReportRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker,
                                     StudyGroupsProperties properties) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.tableName = properties.getTableName();
        this.reportSchema = TableSchema.fromBean(GroupReport.class);
    }

    @Override
    public void save(GroupReport report) {
        queryTracker.trackQuery("PutItem", tableName, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(reportSchema.itemToMap(report, true))
                    .conditionExpression("attribute_not_exists(pk)")
                    .build());
                logger.debug("Saved report {} for group {}", report.getReportId(), report.getGroupId());
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to save report {} for group {}", report.getReportId(), report.getGroupId(), e);
                throw new RepositoryException("Failed to save report", e);
            }
        });
    }
}
