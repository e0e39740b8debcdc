package com.seoautomation.report.service;

import com.seoautomation.report.ReportFixtures;
import com.seoautomation.report.model.Forecast;
import com.seoautomation.report.model.Report;
import com.seoautomation.report.model.ScoringResult;
import com.seoautomation.report.model.Trend;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.seoautomation.report.service.RecommendationGeneratorTest.trend;
import static org.assertj.core.api.Assertions.assertThat;

class NarrativeBuilderTest {

    private final NarrativeBuilder builder = new NarrativeBuilder(ReportFixtures.properties());
    private final ScoringEngine engine = ReportFixtures.scoringEngine(ReportFixtures.properties());

    @Test
    void shouldDescribeStrongSite() {
        ScoringResult scoring = engine.score(ReportFixtures.strongMeasurement("https://shop.example.com"));

        Report.Swot swot = builder.swot(scoring, Trend.insufficient());

        assertThat(swot.strengths()).containsExactly(
                "Strong on-page SEO foundation",
                "Excellent technical performance",
                "High-quality content",
                "Great user experience",
                "Good domain authority");
        assertThat(swot.weaknesses()).containsExactly("No major weaknesses detected");
        assertThat(swot.opportunities()).containsExactly("Incremental improvements across all areas");
        assertThat(swot.threats()).containsExactly("Standard competitive pressures");
    }

    @Test
    void shouldDescribeWeakDecliningSite() {
        ScoringResult scoring = engine.score(ReportFixtures.weakMeasurement("http://legacy.example.org"));

        Report.Swot swot = builder.swot(scoring, trend(-12));

        assertThat(swot.strengths()).containsExactly("Solid baseline performance");
        assertThat(swot.weaknesses()).contains("On-page SEO needs improvement", "3 critical issues found");
        assertThat(swot.opportunities()).containsExactly("SEO audit reveals multiple optimization opportunities");
        assertThat(swot.threats()).containsExactly(
                "Negative trend detected - immediate action required",
                "Multiple critical issues could impact rankings",
                "Missing HTTPS - security and ranking risk");
    }

    @Test
    void shouldCallOutMomentumAndQuickWinBands() {
        ScoringResult scoring = RecommendationGeneratorTest.scoring(70, 80, 70, 80, 60);

        assertThat(builder.swot(scoring, trend(8)).opportunities()).containsExactly(
                "Quick wins available in on-page optimization",
                "Content enhancement could drive significant gains",
                "Strong positive momentum - capitalize on current trajectory");
    }

    @Test
    void shouldFlagGrowthPotentialForConfidentForecast() {
        ScoringResult scoring = RecommendationGeneratorTest.scoring(80, 80, 80, 80, 80);
        Forecast forecast = Forecast.builder().predictedScore(85).confidence(0.8).timeframe("1 month").build();

        assertThat(builder.insights(scoring, List.of(), forecast))
                .containsExactly("Strong growth potential with recommended improvements");
    }

    @Test
    void shouldFlagDeclineRiskForConfidentForecast() {
        ScoringResult scoring = RecommendationGeneratorTest.scoring(80, 80, 80, 80, 80);
        Forecast forecast = Forecast.builder().predictedScore(60).confidence(0.75).timeframe("1 month").build();

        assertThat(builder.insights(scoring, List.of(), forecast))
                .containsExactly("Risk of decline without immediate action");
    }
}
