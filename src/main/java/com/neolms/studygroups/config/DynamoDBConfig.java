package com.neolms.studygroups.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

/**
 * Store clients for the study groups table, configured from {@code study-groups.dynamodb.*}.
 */
@Configuration
public class DynamoDBConfig {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBConfig.class);

    @Bean
    public DynamoDbClient dynamoDbClient(StudyGroupsProperties properties) {
        StudyGroupsProperties.Dynamodb settings = properties.getDynamodb();
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(settings.getRegion()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(settings.getApiCallTimeout())
                        .build())
                .credentialsProvider(credentialsFor(settings));

        if (settings.isLocal()) {
            builder.endpointOverride(URI.create(settings.getEndpoint()));
            logger.info("Using local DynamoDB at {} for table {}", settings.getEndpoint(), properties.getTableName());
        } else {
            logger.info("Using DynamoDB in {} for table {}", settings.getRegion(), properties.getTableName());
        }
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    static AwsCredentialsProvider credentialsFor(StudyGroupsProperties.Dynamodb settings) {
        if (settings.isLocal()) {
            // DynamoDB Local ignores the key pair
            return StaticCredentialsProvider.create(AwsBasicCredentials.create("local", "local"));
        }
        return DefaultCredentialsProvider.create();
    }
}
