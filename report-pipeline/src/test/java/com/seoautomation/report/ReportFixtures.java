package com.seoautomation.report;

import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.model.Forecast;
import com.seoautomation.report.model.HistoricalPoint;
import com.seoautomation.report.model.RawMeasurement;
import com.seoautomation.report.model.Recommendation;
import com.seoautomation.report.model.Report;
import com.seoautomation.report.model.ReportPeriod;
import com.seoautomation.report.model.ScoringResult;
import com.seoautomation.report.model.Trend;
import com.seoautomation.report.service.ForecastCalculator;
import com.seoautomation.report.service.ImpactRecommendationAdvisor;
import com.seoautomation.report.service.IssueDetector;
import com.seoautomation.report.service.MeasurementValidator;
import com.seoautomation.report.service.NarrativeBuilder;
import com.seoautomation.report.service.RecommendationGenerator;
import com.seoautomation.report.service.ReportCompiler;
import com.seoautomation.report.service.ScoringEngine;
import com.seoautomation.report.service.StaticCompetitorComparisonProvider;
import com.seoautomation.report.service.TrendAnalyzer;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared measurements and wiring for unit tests.
 */
public final class ReportFixtures {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-11T09:00:00Z"), ZoneOffset.UTC);
    public static final LocalDate PERIOD_START = LocalDate.of(2024, 3, 11);

    private ReportFixtures() {
    }

    public static String text(int length) {
        return "x".repeat(length);
    }

    /**
     * Everything at or near best practice: on-page 100, technical 100, content 100, UX 100,
     * authority 86.
     */
    public static RawMeasurement strongMeasurement(String url) {
        return RawMeasurement.builder()
                .url(url)
                .lighthouse(RawMeasurement.Lighthouse.builder()
                        .performance(1.0).accessibility(1.0).bestPractices(1.0).seo(1.0)
                        .firstContentfulPaintAudit(1.0).largestContentfulPaintAudit(1.0).mobileFriendlyAudit(1.0)
                        .build())
                .html(RawMeasurement.Html.builder()
                        .title(text(55))
                        .description(text(140))
                        .canonical(url)
                        .ssl(true).responsive(true).html5(true).schemaMarkup(true)
                        .h1Count(1).h2Count(3).h3Count(4)
                        .imagesTotal(10).imagesWithAlt(10)
                        .internalLinks(12).externalLinks(3)
                        .wordCount(1600).readabilityGrade(7.0).keywordDensity(1.5)
                        .optimizedImages(10).checkedImages(10)
                        .build())
                .performance(RawMeasurement.Performance.builder()
                        .lcpMs(2000.0).fidMs(50.0).cls(0.05).fcpMs(900.0).ttfbMs(200.0)
                        .domInteractiveMs(1500.0).loadEventMs(2200.0)
                        .build())
                .backlinks(RawMeasurement.Backlinks.builder()
                        .domainAuthority(80.0).pageAuthority(60.0).backlinks(25000L)
                        .referringDomains(1200).spamScore(1.0)
                        .build())
                .build();
    }

    /**
     * Insecure page with failing audits, no title, no H1 and missing alt text.
     */
    public static RawMeasurement weakMeasurement(String url) {
        return RawMeasurement.builder()
                .url(url)
                .lighthouse(RawMeasurement.Lighthouse.builder()
                        .performance(0.4).accessibility(0.6).bestPractices(0.5).seo(0.6)
                        .firstContentfulPaintAudit(0.3).largestContentfulPaintAudit(0.2).mobileFriendlyAudit(0.0)
                        .build())
                .html(RawMeasurement.Html.builder()
                        .title("")
                        .description("Welcome")
                        .ssl(false).responsive(false)
                        .h1Count(0).h2Count(1).h3Count(0)
                        .imagesTotal(12).imagesWithAlt(4)
                        .internalLinks(2)
                        .wordCount(250).readabilityGrade(15.0).keywordDensity(4.0)
                        .optimizedImages(1).checkedImages(12)
                        .build())
                .performance(RawMeasurement.Performance.builder()
                        .lcpMs(6000.0).fidMs(400.0).cls(0.3)
                        .build())
                .build();
    }

    public static ReportPipelineProperties properties() {
        return new ReportPipelineProperties();
    }

    public static ScoringEngine scoringEngine(ReportPipelineProperties properties) {
        return new ScoringEngine(properties, new MeasurementValidator(), new IssueDetector(properties));
    }

    public static ReportCompiler compiler(ReportPipelineProperties properties, Clock clock) {
        return new ReportCompiler(properties, new NarrativeBuilder(properties),
                new StaticCompetitorComparisonProvider(), clock);
    }

    public static List<HistoricalPoint> weeklyHistory(LocalDate currentStart, double... scores) {
        List<HistoricalPoint> points = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            LocalDate date = currentStart.minusWeeks(scores.length - i);
            points.add(new HistoricalPoint(date, scores[i], 6 - i % 3, i, 1000L + i * 100L));
        }
        return points;
    }

    /**
     * Runs the stages in-process (no collector, no scheduler) and compiles a report.
     */
    public static Report report(RawMeasurement measurement, List<HistoricalPoint> prior) {
        ReportPipelineProperties properties = properties();
        ScoringResult scoring = scoringEngine(properties).score(measurement);

        List<HistoricalPoint> series = new ArrayList<>(prior);
        series.add(new HistoricalPoint(PERIOD_START, scoring.getOverallScore(), scoring.getIssues().size(), 0, 0));
        Trend trend = new TrendAnalyzer(properties).analyze(series);

        List<Recommendation> recommendations = new RecommendationGenerator(
                new ImpactRecommendationAdvisor(properties), properties).generate(scoring, trend);
        Forecast forecast = new ForecastCalculator(properties)
                .forecast(scoring.getOverallScore(), trend, recommendations, scoring.getIssues().size());

        return compiler(properties, FIXED_CLOCK).compile(new ReportCompiler.Inputs(measurement.getUrl(),
                ReportPeriod.weekOf(PERIOD_START), scoring, series, trend, recommendations, forecast));
    }

    public static Report sampleReport() {
        return report(weakMeasurement("http://legacy.example.org"),
                weeklyHistory(PERIOD_START, 48, 46, 45, 44));
    }
}
