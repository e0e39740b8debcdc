package com.seoautomation.report.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Compiled report for one (url, period). Created once by the compiler from fully computed
 * stage outputs and never modified afterwards.
 */
@Value
@Builder
public class Report {

    String id;
    String url;
    LocalDate periodStart;
    LocalDate periodEnd;
    Instant generatedAt;

    // ── Summary ─────────────────────────────────────────────────────────────
    int overallScore;
    String grade;
    String status;
    /** improving | declining | stable */
    String direction;

    // ── Scores ──────────────────────────────────────────────────────────────
    Map<ScoreCategory, CategoryScore> categoryScores;
    List<Double> historicalScores;

    // ── Issues ──────────────────────────────────────────────────────────────
    List<Issue> issues;
    IssueSummary issueSummary;

    // ── Derived analysis ────────────────────────────────────────────────────
    Trend trend;
    List<Recommendation> recommendations;
    RecommendationSummary recommendationSummary;
    Forecast forecast;
    Swot narrative;
    List<String> actionableInsights;
    Comparisons comparisons;

    /** Extracted measurement snapshots keyed by section: performance, seo, technical */
    Map<String, Map<String, Object>> metrics;

    Metadata metadata;

    public ReportKey key() {
        return new ReportKey(url, periodStart);
    }

    public record IssueSummary(int total, Map<String, Integer> bySeverity, Map<String, Integer> byType,
                               List<Issue> top) {}

    public record RecommendationSummary(int total, Map<String, Integer> byPriority, int estimatedImpact,
                                        List<TimelineEntry> timeline) {}

    public record TimelineEntry(int week, List<String> tasks) {}

    public record Swot(List<String> strengths, List<String> weaknesses, List<String> opportunities,
                       List<String> threats) {}

    public record Comparisons(int industryAverage, List<CompetitorSnapshot> competitors,
                              Trend.WeeklyChange previousPeriod) {}

    public record CompetitorSnapshot(String name, int score, List<String> strengths, List<String> weaknesses) {}

    public record Metadata(String version, String analysisMethod, List<String> dataSources, double confidence,
                           List<String> defaultedInputs) {}
}
