package com.tickwork.scheduler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Infrastructure beans of the custom job scheduler.
 */
@Configuration
public class CustomJobConfiguration {

    public static final String EXECUTOR_BEAN = "customJobExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Worker pool that runs job handlers. Polling threads only hand work to it.
     */
    @Bean(name = EXECUTOR_BEAN)
    public ThreadPoolTaskExecutor customJobExecutor(CustomJobProperties properties) {
        CustomJobProperties.Worker worker = properties.getWorker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(worker.getCorePoolSize());
        executor.setMaxPoolSize(worker.getMaxPoolSize());
        executor.setQueueCapacity(worker.getQueueCapacity());
        executor.setThreadNamePrefix("custom-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
