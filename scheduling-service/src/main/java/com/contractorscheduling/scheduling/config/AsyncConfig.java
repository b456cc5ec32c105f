package com.contractorscheduling.scheduling.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor for work that must not hold up a request, such as deposit intents after a booking commits.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "schedulingExecutor")
    public Executor schedulingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("scheduling-");
        executor.initialize();
        return executor;
    }
}
