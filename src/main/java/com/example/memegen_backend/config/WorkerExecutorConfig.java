package com.example.memegen_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the thread pools used by {@link com.example.memegen_backend.service.ImageRenderService}
 * and {@link com.example.memegen_backend.service.TrackingService}.
 */
@Configuration
@EnableConfigurationProperties(WorkerExecutorProperties.class)
public class WorkerExecutorConfig {

    @Bean(name = "renderTaskExecutor")
    public ThreadPoolTaskExecutor renderTaskExecutor(WorkerExecutorProperties properties) {
        return build(properties.getRender(), "render-", true);
    }

    /**
     * Tracking tasks are detached from the request: shutdown does not wait for them.
     */
    @Bean(name = "trackingTaskExecutor")
    public ThreadPoolTaskExecutor trackingTaskExecutor(WorkerExecutorProperties properties) {
        return build(properties.getTracking(), "tracking-", false);
    }

    private ThreadPoolTaskExecutor build(WorkerExecutorProperties.Pool pool, String prefix, boolean waitOnShutdown) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, pool.getThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(waitOnShutdown);
        executor.initialize();
        return executor;
    }
}
