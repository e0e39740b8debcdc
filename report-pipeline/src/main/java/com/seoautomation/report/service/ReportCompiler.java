package com.seoautomation.report.service;

import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.model.Effort;
import com.seoautomation.report.model.Forecast;
import com.seoautomation.report.model.HistoricalPoint;
import com.seoautomation.report.model.Issue;
import com.seoautomation.report.model.IssueSeverity;
import com.seoautomation.report.model.Priority;
import com.seoautomation.report.model.RawMeasurement;
import com.seoautomation.report.model.Recommendation;
import com.seoautomation.report.model.Report;
import com.seoautomation.report.model.ReportPeriod;
import com.seoautomation.report.model.ScoringResult;
import com.seoautomation.report.model.Trend;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Assembles the immutable {@link Report} from finished stage outputs.
 *
 * The report id is derived from (url, period start) so that compiling the same inputs
 * twice yields the same report apart from {@code generatedAt}.
 */
@Service
@RequiredArgsConstructor
public class ReportCompiler {

    private final ReportPipelineProperties properties;
    private final NarrativeBuilder narrativeBuilder;
    private final CompetitorComparisonProvider competitorProvider;
    private final Clock clock;

    /** Everything the compiler reads. The series is oldest first with the current period last. */
    public record Inputs(String url, ReportPeriod period, ScoringResult scoring, List<HistoricalPoint> series,
                         Trend trend, List<Recommendation> recommendations, Forecast forecast) {}

    public Report compile(Inputs in) {
        ScoringResult scoring = in.scoring();
        ReportPipelineProperties.ReportSettings settings = properties.getReport();
        int overall = scoring.getOverallScore();

        return Report.builder()
                .id(reportId(in.url(), in.period()))
                .url(in.url())
                .periodStart(in.period().start())
                .periodEnd(in.period().end())
                .generatedAt(Instant.now(clock))
                .overallScore(overall)
                .grade(grade(overall))
                .status(status(overall))
                .direction(direction(in.trend()))
                .categoryScores(scoring.getCategoryScores())
                .historicalScores(in.series().stream().map(HistoricalPoint::overallScore).toList())
                .issues(scoring.getIssues())
                .issueSummary(issueSummary(scoring.getIssues()))
                .trend(in.trend())
                .recommendations(in.recommendations())
                .recommendationSummary(recommendationSummary(in.recommendations()))
                .forecast(in.forecast())
                .narrative(narrativeBuilder.swot(scoring, in.trend()))
                .actionableInsights(narrativeBuilder.insights(scoring, in.recommendations(), in.forecast()))
                .comparisons(new Report.Comparisons(settings.getIndustryAverage(),
                        competitorProvider.competitorsFor(in.url(), overall),
                        in.trend().getWeeklyChange()))
                .metrics(metrics(scoring.getMeasurement()))
                .metadata(new Report.Metadata(settings.getVersion(), "comprehensive", settings.getDataSources(),
                        in.trend().isHasEnoughData() ? in.trend().getConfidence() : 0.7,
                        scoring.getDefaultedInputs()))
                .build();
    }

    public static String reportId(String url, ReportPeriod period) {
        return UUID.nameUUIDFromBytes((url + "|" + period.start()).getBytes(StandardCharsets.UTF_8)).toString();
    }

    // ── Summary labels ──────────────────────────────────────────────────────

    static String grade(int score) {
        if (score >= 90) return "A+";
        if (score >= 85) return "A";
        if (score >= 80) return "A-";
        if (score >= 75) return "B+";
        if (score >= 70) return "B";
        if (score >= 65) return "B-";
        if (score >= 60) return "C+";
        if (score >= 50) return "C";
        if (score >= 40) return "D";
        return "F";
    }

    static String status(int score) {
        if (score >= 80) return "Excellent";
        if (score >= 70) return "Good";
        if (score >= 60) return "Needs Improvement";
        if (score >= 50) return "Poor";
        return "Critical";
    }

    static String direction(Trend trend) {
        double change = trend.getWeeklyChange().score();
        if (change > 0) return "improving";
        if (change < 0) return "declining";
        return "stable";
    }

    // ── Sections ────────────────────────────────────────────────────────────

    private Report.IssueSummary issueSummary(List<Issue> issues) {
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (IssueSeverity severity : IssueSeverity.values()) {
            bySeverity.put(severity.value(), 0);
        }
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (Issue issue : issues) {
            bySeverity.merge(issue.getSeverity().value(), 1, Integer::sum);
            byType.merge(issue.getType(), 1, Integer::sum);
        }
        List<Issue> top = issues.stream().limit(properties.getReport().getTopIssues()).toList();
        return new Report.IssueSummary(issues.size(), bySeverity, byType, top);
    }

    private Report.RecommendationSummary recommendationSummary(List<Recommendation> recommendations) {
        Map<String, Integer> byPriority = new LinkedHashMap<>();
        for (Priority priority : Priority.values()) {
            byPriority.put(priority.value(), 0);
        }
        recommendations.forEach(r -> byPriority.merge(r.getPriority().value(), 1, Integer::sum));
        int impact = recommendations.stream().mapToInt(Recommendation::getEstimatedImpact).sum();
        return new Report.RecommendationSummary(recommendations.size(), byPriority, impact, timeline(recommendations));
    }

    /**
     * Low effort items in week 1, medium in week 2, high in week 4.
     */
    List<Report.TimelineEntry> timeline(List<Recommendation> recommendations) {
        List<Report.TimelineEntry> timeline = new ArrayList<>();
        addTimelineEntry(timeline, 1, recommendations, Effort.LOW, 3);
        addTimelineEntry(timeline, 2, recommendations, Effort.MEDIUM, 2);
        addTimelineEntry(timeline, 4, recommendations, Effort.HIGH, 2);
        return timeline;
    }

    private void addTimelineEntry(List<Report.TimelineEntry> timeline, int week, List<Recommendation> recs,
                                  Effort effort, int limit) {
        List<String> tasks = recs.stream()
                .filter(r -> r.getEstimatedEffort() == effort)
                .limit(limit)
                .map(Recommendation::getTitle)
                .toList();
        if (!tasks.isEmpty()) {
            timeline.add(new Report.TimelineEntry(week, tasks));
        }
    }

    private Map<String, Map<String, Object>> metrics(RawMeasurement m) {
        Map<String, Map<String, Object>> metrics = new LinkedHashMap<>();
        Map<String, Object> performance = new LinkedHashMap<>();
        Map<String, Object> seo = new LinkedHashMap<>();
        Map<String, Object> technical = new LinkedHashMap<>();

        RawMeasurement.Performance perf = m == null ? null : m.getPerformance();
        if (perf != null) {
            putIfPresent(performance, "pageLoadMs", perf.getLoadEventMs());
            putIfPresent(performance, "firstContentfulPaintMs", perf.getFcpMs());
            putIfPresent(performance, "largestContentfulPaintMs", perf.getLcpMs());
            putIfPresent(performance, "cumulativeLayoutShift", perf.getCls());
            putIfPresent(performance, "firstInputDelayMs", perf.getFidMs());
            putIfPresent(performance, "timeToFirstByteMs", perf.getTtfbMs());
            putIfPresent(performance, "domInteractiveMs", perf.getDomInteractiveMs());
        }

        RawMeasurement.Html html = m == null ? null : m.getHtml();
        if (html != null) {
            seo.put("titleLength", html.getTitle() == null ? 0 : html.getTitle().length());
            seo.put("descriptionLength", html.getDescription() == null ? 0 : html.getDescription().length());
            seo.put("h1Count", IssueDetector.intOrZero(html.getH1Count()));
            seo.put("h2Count", IssueDetector.intOrZero(html.getH2Count()));
            seo.put("h3Count", IssueDetector.intOrZero(html.getH3Count()));
            seo.put("internalLinks", IssueDetector.intOrZero(html.getInternalLinks()));
            seo.put("externalLinks", IssueDetector.intOrZero(html.getExternalLinks()));
            int withAlt = IssueDetector.intOrZero(html.getImagesWithAlt());
            seo.put("imagesWithAlt", withAlt);
            seo.put("imagesWithoutAlt", Math.max(0, IssueDetector.intOrZero(html.getImagesTotal()) - withAlt));

            technical.put("ssl", IssueDetector.usesHttps(m));
            technical.put("responsive", Boolean.TRUE.equals(html.getResponsive()));
            technical.put("html5", Boolean.TRUE.equals(html.getHtml5()));
            technical.put("canonical", html.getCanonical() != null && !html.getCanonical().isBlank());
            technical.put("schemaMarkup", Boolean.TRUE.equals(html.getSchemaMarkup()));
        }

        metrics.put("performance", performance);
        metrics.put("seo", seo);
        metrics.put("technical", technical);
        return metrics;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) map.put(key, value);
    }
}
