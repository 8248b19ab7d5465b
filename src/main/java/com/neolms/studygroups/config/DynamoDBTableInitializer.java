package com.neolms.studygroups.config;

import com.neolms.studygroups.model.StudyGroup;
import com.neolms.studygroups.util.StudyGroupKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the single study groups table and its three GSIs on startup, for local
 * development against DynamoDB Local. Deployed tables are provisioned outside the app.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true")
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;
    private final StudyGroupsProperties properties;

    @Autowired
    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient, StudyGroupsProperties properties) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(properties.getTableName());
    }

    private void createTableIfNotExists(String tableName) {
        // Every item type shares the BaseItem key and index attributes
        DynamoDbTable<StudyGroup> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(StudyGroup.class));
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);

        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput())
                .globalSecondaryIndices(
                    createGSI(StudyGroupKeyFactory.USER_GROUP_INDEX),
                    createGSI(StudyGroupKeyFactory.DIRECTORY_INDEX),
                    createGSI(StudyGroupKeyFactory.INVITE_CODE_INDEX))
                .build());
            logger.info("Table {} created successfully with GSIs", tableName);
        } catch (RuntimeException e) {
            logger.error("Error creating table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }

    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }
}
