package com.neolms.studygroups.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * Runs session mutations and resyncs. When the queue is full the submitting thread runs
     * the task itself, which slows STOMP inbound handling instead of dropping work.
     */
    @Bean(name = "groupSyncExecutor")
    public Executor groupSyncExecutor(StudyGroupsProperties properties) {
        StudyGroupsProperties.Sync sync = properties.getSync();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sync.getCorePoolSize());
        executor.setMaxPoolSize(sync.getMaxPoolSize());
        executor.setQueueCapacity(sync.getQueueCapacity());
        executor.setThreadNamePrefix("group-sync-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
