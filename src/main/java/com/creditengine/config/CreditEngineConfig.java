package com.creditengine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;

/**
 * Infrastructure beans shared by the credit engine services.
 */
@Configuration
public class CreditEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Single-threaded scheduler for the overdue sweep; on shutdown a running sweep gets
     * up to {@code credit-engine.overdue.shutdown-timeout} to finish.
     */
    @Bean
    public TaskScheduler overdueTaskScheduler(
            @Value("${credit-engine.overdue.shutdown-timeout:PT30S}") Duration shutdownTimeout) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("overdue-sweep-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds((int) shutdownTimeout.toSeconds());
        return scheduler;
    }
}
