package com.seoautomation.report.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, ReportPipelineProperties properties) {
        ReportPipelineProperties.Collector c = properties.getCollector();
        return builder
                .setConnectTimeout(Duration.ofMillis(c.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(c.getReadTimeoutMs()))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
