package com.neolms.studygroups.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "study-groups")
public class StudyGroupsProperties {

    private String tableName = "StudyGroupsTable";

    // Origin prepended to /join/{code} in shareable invite links
    private String inviteBaseUrl = "http://localhost:3000";

    private final Sync sync = new Sync();

    private final Dynamodb dynamodb = new Dynamodb();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getInviteBaseUrl() {
        return inviteBaseUrl;
    }

    public void setInviteBaseUrl(String inviteBaseUrl) {
        this.inviteBaseUrl = inviteBaseUrl;
    }

    public Sync getSync() {
        return sync;
    }

    public Dynamodb getDynamodb() {
        return dynamodb;
    }

    public static class Dynamodb {

        private String region = "us-east-1";

        // Blank means the regional AWS endpoint
        private String endpoint = "";

        private Duration apiCallTimeout = Duration.ofSeconds(10);

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public Duration getApiCallTimeout() {
            return apiCallTimeout;
        }

        public void setApiCallTimeout(Duration apiCallTimeout) {
            this.apiCallTimeout = apiCallTimeout;
        }

        public boolean isLocal() {
            return endpoint != null && !endpoint.isBlank();
        }
    }

    public static class Sync {

        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
