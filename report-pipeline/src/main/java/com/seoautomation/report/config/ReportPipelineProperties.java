package com.seoautomation.report.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Every tunable constant of the report pipeline: scoring weights and thresholds,
 * trend and forecast factors, scheduler limits, provider and storage settings.
 *
 * Defaults here are the production model. Tests construct this class directly.
 */
@Component
@ConfigurationProperties(prefix = "seo-report")
@Validated
@Data
public class ReportPipelineProperties {

    private Scoring scoring = new Scoring();
    private TrendSettings trend = new TrendSettings();
    private Recommendations recommendations = new Recommendations();
    private ForecastSettings forecast = new ForecastSettings();
    private ReportSettings report = new ReportSettings();
    @Valid
    private Scheduler scheduler = new Scheduler();
    private Collector collector = new Collector();
    private Storage storage = new Storage();

    @Data
    public static class Scoring {
        private Weights weights = new Weights();
        private LighthouseWeights lighthouseWeights = new LighthouseWeights();

        private int titleMinLength = 50;
        private int titleMaxLength = 60;
        private int descriptionMinLength = 120;
        private int descriptionMaxLength = 160;

        private double httpsBonus = 10;
        private double responsiveBonus = 10;
        private double canonicalBonus = 5;

        private double keywordDensityMin = 0.5;
        private double keywordDensityMax = 2.5;

        private double lcpGoodMs = 2500;
        private double lcpPoorMs = 4000;
        private double fidGoodMs = 100;
        private double fidPoorMs = 300;
        private double clsGood = 0.1;
        private double clsPoor = 0.25;

        /** Lighthouse audit score below which performance issues are raised */
        private double auditPassThreshold = 0.9;

        private Defaults defaults = new Defaults();
    }

    @Data
    public static class Weights {
        private double onPage = 0.25;
        private double technical = 0.25;
        private double content = 0.20;
        private double ux = 0.15;
        private double authority = 0.15;
    }

    @Data
    public static class LighthouseWeights {
        private double performance = 0.3;
        private double accessibility = 0.2;
        private double bestPractices = 0.2;
        private double seo = 0.3;
    }

    /**
     * Substitutes for provider data that never arrived.
     */
    @Data
    public static class Defaults {
        private double authorityScore = 50;
        /** Applied to on-page and content when the HTML facts are missing */
        private double categoryScore = 50;
        /** Lighthouse category score assumed when the audit is missing */
        private double lighthouseScore = 0.5;
    }

    @Data
    public static class TrendSettings {
        private int slopeWindow = 4;
        private double stableBandPercent = 5;
        private double velocityMultiplier = 4;
        private double minConfidence = 0.3;
        private double maxConfidence = 0.9;
        private double confidenceScale = 0.8;
    }

    @Data
    public static class Recommendations {
        private int maxRecommendations = 5;
        private double onPageThreshold = 70;
        private double onPageHighPriorityThreshold = 50;
        private double technicalThreshold = 60;
        private double contentThreshold = 60;
        private double authorityThreshold = 50;
        private double decliningVelocity = -3;
    }

    @Data
    public static class ForecastSettings {
        private double recommendationImpact = 5;
        private double velocityFactor = 0.25;
        private String timeframe = "1 month";
        private double bestCaseMultiplier = 1.15;
        private double worstCaseMultiplier = 0.85;
        private double issuePenalty = 0.02;
    }

    @Data
    public static class ReportSettings {
        private int industryAverage = 68;
        private String version = "2.0";
        private int topIssues = 10;
        private int maxInsights = 3;
        private List<String> dataSources = List.of(
                "Lighthouse", "HTML Analysis", "Performance Metrics", "Backlink APIs");
    }

    @Data
    public static class Scheduler {
        @Min(1)
        private int maxWorkers = 3;
        private long pollIntervalMs = 1000;
        @Min(1)
        private int maxQueueSize = 100;
        private long estimatedSecondsPerJob = 30;
        private long collectorTimeoutSeconds = 30;
        private int historyWindow = 12;
        private long jobRetentionHours = 24;
    }

    @Data
    public static class Collector {
        private CollectorMode mode = CollectorMode.HTTP;
        private String baseUrl = "http://localhost:8090/api/v1";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 25000;
        private String fixtureLocation = "classpath:fixtures/*.json";

        public enum CollectorMode {
            HTTP, FIXTURE
        }
    }

    @Data
    public static class Storage {
        private HistoryMode history = HistoryMode.MEMORY;
        private ClickHouse clickhouse = new ClickHouse();

        @Data
        public static class ClickHouse {
            private String url = "jdbc:clickhouse://localhost:8123/seo_report";
            private String username = "default";
            private String password = "";
        }

        public enum HistoryMode {
            MEMORY, CLICKHOUSE
        }
    }
}
