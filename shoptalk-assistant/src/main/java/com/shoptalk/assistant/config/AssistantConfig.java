package com.shoptalk.assistant.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AssistantConfig {

    /**
     * Executor for bundle candidate searches, which run concurrently per item type.
     */
    @Bean(name = "bundleSearchExecutor")
    public Executor bundleSearchExecutor(AssistantProperties assistantProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = assistantProperties.getBundle().getSearchThreads();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("bundle-search-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
