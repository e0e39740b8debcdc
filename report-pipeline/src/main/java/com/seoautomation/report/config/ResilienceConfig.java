package com.seoautomation.report.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    public TimeLimiter collectorTimeLimiter(ReportPipelineProperties properties) {
        // hard upper bound on one measurement fetch, retries included
        return TimeLimiter.of("metricCollector", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(properties.getScheduler().getCollectorTimeoutSeconds()))
                .cancelRunningFuture(true)
                .build());
    }
}
