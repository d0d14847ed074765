package com.defai.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Runs time-limited calls into signal sources and the classifier.
     */
    @Bean(name = "sourceExecutor")
    public ThreadPoolTaskExecutor sourceExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(4, processors));
        executor.setMaxPoolSize(Math.max(16, processors * 4));
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("source-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Fans out per-token analyses when the whole tracked set is recomputed.
     */
    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(2, processors / 2));
        executor.setMaxPoolSize(Math.max(8, processors * 2));
        executor.setQueueCapacity(250);
        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
