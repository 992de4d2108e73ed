package com.prospectpulse.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool that runs enqueued jobs. With {@code prospectpulse.jobs.inline=true}
 * jobs run on the enqueuing thread instead.
 */
@Configuration
public class JobExecutionConfig {

    @Value("${prospectpulse.jobs.worker-threads:4}")
    private int workerThreads;

    @Value("${prospectpulse.jobs.queue-capacity:100}")
    private int queueCapacity;

    @Value("${prospectpulse.jobs.inline:false}")
    private boolean inline;

    @Bean(name = "jobExecutor")
    public TaskExecutor jobExecutor() {
        if (inline) {
            return new SyncTaskExecutor();
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerThreads);
        executor.setMaxPoolSize(workerThreads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("job-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "streamExecutor")
    public TaskExecutor streamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("job-stream-");
        executor.initialize();
        return executor;
    }
}
