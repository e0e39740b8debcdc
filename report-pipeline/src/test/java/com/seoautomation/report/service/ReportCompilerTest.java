package com.seoautomation.report.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seoautomation.report.ReportFixtures;
import com.seoautomation.report.model.Report;
import com.seoautomation.report.model.ReportPeriod;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class ReportCompilerTest {

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();

    @Test
    void shouldCompileIdenticalReportsFromIdenticalInputs() throws Exception {
        Report first = ReportFixtures.sampleReport();
        Report second = ReportFixtures.sampleReport();

        assertThat(second).isEqualTo(first);
        assertThat(objectMapper.writeValueAsBytes(second)).isEqualTo(objectMapper.writeValueAsBytes(first));
    }

    @Test
    void shouldDeriveReportIdFromUrlAndPeriod() {
        Report report = ReportFixtures.sampleReport();

        assertThat(report.getId())
                .isEqualTo(ReportCompiler.reportId("http://legacy.example.org", ReportPeriod.weekOf(ReportFixtures.PERIOD_START)));
        assertThat(report.getId())
                .isNotEqualTo(ReportCompiler.reportId("http://legacy.example.org",
                        ReportPeriod.weekOf(ReportFixtures.PERIOD_START.plusWeeks(1))));
        assertThat(report.getPeriodEnd()).isEqualTo(ReportFixtures.PERIOD_START.plusWeeks(1));
        assertThat(report.getGeneratedAt()).isEqualTo(ReportFixtures.FIXED_CLOCK.instant());
    }

    @Test
    void shouldSummariseWeakDecliningSite() {
        Report report = ReportFixtures.sampleReport();

        assertThat(report.getOverallScore()).isEqualTo(35);
        assertThat(report.getGrade()).isEqualTo("F");
        assertThat(report.getStatus()).isEqualTo("Critical");
        assertThat(report.getDirection()).isEqualTo("declining");
        assertThat(report.getHistoricalScores()).containsExactly(48.0, 46.0, 45.0, 44.0, 35.0);

        assertThat(report.getIssueSummary().total()).isEqualTo(6);
        assertThat(report.getIssueSummary().bySeverity())
                .containsEntry("critical", 3).containsEntry("warning", 3).containsEntry("info", 0);
        assertThat(report.getIssueSummary().byType())
                .containsEntry("performance", 2).containsEntry("seo", 2)
                .containsEntry("accessibility", 1).containsEntry("security", 1);

        assertThat(report.getRecommendationSummary().total()).isEqualTo(4);
        assertThat(report.getRecommendationSummary().estimatedImpact()).isEqualTo(57);
        assertThat(report.getRecommendationSummary().byPriority())
                .containsEntry("high", 3).containsEntry("medium", 1).containsEntry("low", 0);
    }

    @Test
    void shouldBuildTimelineByEffort() {
        List<Report.TimelineEntry> timeline = ReportFixtures.sampleReport().getRecommendationSummary().timeline();

        assertThat(timeline).extracting(Report.TimelineEntry::week).containsExactly(1, 2, 4);
        assertThat(timeline.get(0).tasks()).containsExactly("Improve On-Page SEO");
        assertThat(timeline.get(1).tasks()).containsExactly("Optimize Core Web Vitals", "Investigate Score Decline");
        assertThat(timeline.get(2).tasks()).containsExactly("Enhance Content Quality");
    }

    @Test
    void shouldCapActionableInsights() {
        Report report = ReportFixtures.sampleReport();

        assertThat(report.getActionableInsights()).containsExactly(
                "1 quick wins identified with significant impact",
                "3 critical issues need immediate attention",
                "Potential 57% improvement from implementing recommendations");
    }

    @Test
    void shouldFillComparisonsAndMetadata() {
        Report report = ReportFixtures.sampleReport();

        assertThat(report.getComparisons().industryAverage()).isEqualTo(68);
        assertThat(report.getComparisons().competitors()).extracting(Report.CompetitorSnapshot::name)
                .containsExactly("Competitor A", "Competitor B", "legacy.example.org");
        assertThat(report.getComparisons().previousPeriod().score()).isEqualTo(-9.0);

        assertThat(report.getMetadata().version()).isEqualTo("2.0");
        assertThat(report.getMetadata().analysisMethod()).isEqualTo("comprehensive");
        assertThat(report.getMetadata().confidence()).isEqualTo(report.getTrend().getConfidence());
        assertThat(report.getMetadata().defaultedInputs()).containsExactly("backlinks");

        assertThat(report.getMetrics()).containsOnlyKeys("performance", "seo", "technical");
        assertThat(report.getMetrics().get("seo")).containsEntry("titleLength", 0).containsEntry("imagesWithoutAlt", 8);
        assertThat(report.getMetrics().get("technical")).containsEntry("ssl", false);
    }

    @Test
    void shouldUseDefaultConfidenceWithoutHistory() {
        Report report = ReportFixtures.report(ReportFixtures.strongMeasurement("https://shop.example.com"), List.of());

        assertThat(report.getGrade()).isEqualTo("A+");
        assertThat(report.getStatus()).isEqualTo("Excellent");
        assertThat(report.getDirection()).isEqualTo("stable");
        assertThat(report.getTrend().isHasEnoughData()).isFalse();
        assertThat(report.getMetadata().confidence()).isEqualTo(0.7);
        assertThat(report.getForecast().getPredictedScore()).isEqualTo(98);
        assertThat(report.getRecommendations()).isEmpty();
        assertThat(report.getRecommendationSummary().timeline()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "95, A+, Excellent",
            "90, A+, Excellent",
            "87, A, Excellent",
            "80, A-, Excellent",
            "77, B+, Good",
            "70, B, Good",
            "66, B-, Needs Improvement",
            "60, C+, Needs Improvement",
            "55, C, Poor",
            "45, D, Critical",
            "39, F, Critical"
    })
    void shouldMapScoreToGradeAndStatus(int score, String grade, String status) {
        assertThat(ReportCompiler.grade(score)).isEqualTo(grade);
        assertThat(ReportCompiler.status(score)).isEqualTo(status);
    }

    @Test
    void shouldKeySummariesIndependentlyOfDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            Report report = ReportFixtures.sampleReport();

            assertThat(report.getIssueSummary().bySeverity()).containsOnlyKeys("critical", "warning", "info");
            assertThat(report.getRecommendationSummary().byPriority()).containsOnlyKeys("high", "medium", "low");
        } finally {
            Locale.setDefault(original);
        }
    }
}
