package com.seoautomation.report.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * ClickHouse connection for the score history. Only created when
 * {@code seo-report.storage.history=clickhouse}.
 */
@Configuration
@ConditionalOnProperty(name = "seo-report.storage.history", havingValue = "clickhouse")
public class ClickHouseConfig {

    @Bean
    public DataSource historyDataSource(ReportPipelineProperties properties) {
        ReportPipelineProperties.Storage.ClickHouse ch = properties.getStorage().getClickhouse();
        return DataSourceBuilder.create()
                .driverClassName("com.clickhouse.jdbc.ClickHouseDriver")
                .url(ch.getUrl())
                .username(ch.getUsername())
                .password(ch.getPassword())
                .build();
    }

    @Bean
    public JdbcTemplate historyJdbcTemplate(DataSource historyDataSource) {
        return new JdbcTemplate(historyDataSource);
    }
}
