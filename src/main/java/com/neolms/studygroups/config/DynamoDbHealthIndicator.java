package com.neolms.studygroups.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Reports the study groups table status and GSI count.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient, StudyGroupsProperties properties) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = properties.getTableName();
    }

    @Override
    public Health health() {
        try {
            TableDescription table = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(tableName).build()
            ).table();

            if (table.tableStatus() == TableStatus.ACTIVE) {
                return Health.up()
                    .withDetail("table", tableName)
                    .withDetail("gsiCount", table.globalSecondaryIndexes().size())
                    .build();
            }
            return Health.down()
                .withDetail("table", tableName)
                .withDetail("status", table.tableStatusAsString())
                .withDetail("reason", tableName + " not active")
                .build();

        } catch (SdkException e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
