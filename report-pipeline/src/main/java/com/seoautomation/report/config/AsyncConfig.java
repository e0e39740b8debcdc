package com.seoautomation.report.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final ReportPipelineProperties properties;

    /**
     * Runs report jobs. The scheduler never hands it more than max-workers live jobs.
     */
    @Bean
    public ThreadPoolTaskExecutor reportWorkerExecutor() {
        ReportPipelineProperties.Scheduler s = properties.getScheduler();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(s.getMaxWorkers());
        executor.setMaxPoolSize(s.getMaxWorkers());
        executor.setQueueCapacity(s.getMaxQueueSize());
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Report-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Measurement provider calls, so the worker thread can give up on a slow provider.
     */
    @Bean
    public ThreadPoolTaskExecutor collectorExecutor() {
        ReportPipelineProperties.Scheduler s = properties.getScheduler();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(s.getMaxWorkers());
        executor.setMaxPoolSize(s.getMaxWorkers() * 2);
        executor.setQueueCapacity(50);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Collector-");
        executor.initialize();
        return executor;
    }
}
