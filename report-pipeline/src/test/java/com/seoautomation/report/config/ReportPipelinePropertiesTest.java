package com.seoautomation.report.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class ReportPipelinePropertiesTest {

    @Configuration
    @EnableConfigurationProperties(ReportPipelineProperties.class)
    static class PropertiesConfig {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfig.class);

    @Test
    void shouldBindSchedulerSettings() {
        runner.withPropertyValues("seo-report.scheduler.max-workers=5", "seo-report.scheduler.max-queue-size=20")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    ReportPipelineProperties.Scheduler scheduler =
                            context.getBean(ReportPipelineProperties.class).getScheduler();
                    assertThat(scheduler.getMaxWorkers()).isEqualTo(5);
                    assertThat(scheduler.getMaxQueueSize()).isEqualTo(20);
                });
    }

    @Test
    void shouldRejectZeroWorkers() {
        runner.withPropertyValues("seo-report.scheduler.max-workers=0")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasStackTraceContaining("maxWorkers"));
    }

    @Test
    void shouldRejectZeroQueueSize() {
        runner.withPropertyValues("seo-report.scheduler.max-queue-size=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
