package com.seoautomation.report.service;

import com.seoautomation.report.ReportFixtures;
import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.exception.MeasurementValidationException;
import com.seoautomation.report.model.CategoryScore;
import com.seoautomation.report.model.RawMeasurement;
import com.seoautomation.report.model.ScoreCategory;
import com.seoautomation.report.model.ScoringResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoringEngineTest {

    private ReportPipelineProperties properties;
    private ScoringEngine engine;

    @BeforeEach
    void setUp() {
        properties = ReportFixtures.properties();
        engine = ReportFixtures.scoringEngine(properties);
    }

    @Test
    void shouldScoreFullOnPageMarksForBestPracticeMarkup() {
        RawMeasurement.Html html = RawMeasurement.Html.builder()
                .title(ReportFixtures.text(55))
                .description(ReportFixtures.text(140))
                .h1Count(1).h2Count(3).h3Count(4)
                .imagesTotal(8).imagesWithAlt(8)
                .internalLinks(12)
                .build();

        CategoryScore onPage = engine.scoreOnPage(html);

        assertThat(onPage.getScore()).isEqualTo(100.0);
        assertThat(onPage.isDefaulted()).isFalse();
        assertThat(onPage.getContributions()).containsOnlyKeys("title", "description", "headings", "imageAlt", "internalLinks");
    }

    @Test
    void shouldScoreStrongMeasurement() {
        ScoringResult result = engine.score(ReportFixtures.strongMeasurement("https://shop.example.com"));

        assertThat(result.score(ScoreCategory.ON_PAGE)).isEqualTo(100.0);
        assertThat(result.score(ScoreCategory.TECHNICAL)).isEqualTo(100.0);
        assertThat(result.score(ScoreCategory.CONTENT)).isEqualTo(100.0);
        assertThat(result.score(ScoreCategory.UX)).isEqualTo(100.0);
        assertThat(result.score(ScoreCategory.AUTHORITY)).isEqualTo(86.0);
        assertThat(result.getOverallScore()).isEqualTo(98);
        assertThat(result.getIssues()).isEmpty();
        assertThat(result.getDefaultedInputs()).isEmpty();
    }

    @Test
    void shouldScoreWeakMeasurement() {
        ScoringResult result = engine.score(ReportFixtures.weakMeasurement("http://legacy.example.org"));

        assertThat(result.score(ScoreCategory.ON_PAGE)).isEqualTo(16.2);
        assertThat(result.score(ScoreCategory.TECHNICAL)).isEqualTo(52.0);
        assertThat(result.score(ScoreCategory.CONTENT)).isEqualTo(30.7);
        assertThat(result.score(ScoreCategory.UX)).isEqualTo(27.0);
        assertThat(result.score(ScoreCategory.AUTHORITY)).isEqualTo(50.0);
        assertThat(result.getCategoryScores().get(ScoreCategory.AUTHORITY).isDefaulted()).isTrue();
        assertThat(result.getOverallScore()).isEqualTo(35);
        assertThat(result.getIssues()).hasSize(6);
        assertThat(result.getDefaultedInputs()).containsExactly("backlinks");
    }

    @Test
    void shouldFallBackToDefaultsWhenEverySectionIsMissing() {
        RawMeasurement bare = RawMeasurement.builder().url("https://empty.example.com").build();

        ScoringResult result = engine.score(bare);

        assertThat(result.score(ScoreCategory.ON_PAGE)).isEqualTo(50.0);
        // default lighthouse 0.5 across the board plus the HTTPS bonus from the url scheme
        assertThat(result.score(ScoreCategory.TECHNICAL)).isEqualTo(60.0);
        assertThat(result.score(ScoreCategory.CONTENT)).isEqualTo(50.0);
        assertThat(result.score(ScoreCategory.UX)).isEqualTo(50.0);
        assertThat(result.score(ScoreCategory.AUTHORITY)).isEqualTo(50.0);
        assertThat(result.getOverallScore()).isEqualTo(53);
        assertThat(result.getDefaultedInputs()).containsExactly("lighthouse", "html", "performance", "backlinks");
        assertThat(result.getIssues()).isEmpty();
    }

    @Test
    void shouldKeepEveryScoreWithinBoundsForExtremeInputs() {
        RawMeasurement extreme = ReportFixtures.strongMeasurement("https://big.example.com");
        extreme.getHtml().setInternalLinks(100_000);
        extreme.getHtml().setWordCount(1_000_000);
        extreme.getBacklinks().setReferringDomains(5_000_000);
        extreme.getBacklinks().setDomainAuthority(100.0);
        extreme.getBacklinks().setPageAuthority(100.0);
        extreme.getBacklinks().setSpamScore(0.0);

        ScoringResult result = engine.score(extreme);

        result.getCategoryScores().values()
                .forEach(cs -> assertThat(cs.getScore()).isBetween(0.0, 100.0));
        assertThat(result.getOverallScore()).isEqualTo(100);
    }

    @Test
    void shouldRejectMeasurementWithOutOfRangeValues() {
        RawMeasurement bad = ReportFixtures.strongMeasurement("https://bad.example.com");
        bad.getLighthouse().setPerformance(1.5);
        bad.getHtml().setH2Count(-1);

        assertThatThrownBy(() -> engine.score(bad))
                .isInstanceOf(MeasurementValidationException.class)
                .hasMessageContaining("lighthouse.performance")
                .hasMessageContaining("html.h2Count");
    }

    @Test
    void shouldRejectMeasurementWithoutUrl() {
        RawMeasurement noUrl = ReportFixtures.strongMeasurement(null);

        assertThatThrownBy(() -> engine.score(noUrl))
                .isInstanceOf(MeasurementValidationException.class)
                .hasMessageContaining("url is missing");
    }

    @Test
    void shouldScoreKeywordDensityBands() {
        assertThat(engine.keywordDensityScore(1.0)).isEqualTo(100.0);
        assertThat(engine.keywordDensityScore(0.5)).isEqualTo(100.0);
        assertThat(engine.keywordDensityScore(2.5)).isEqualTo(100.0);
        assertThat(engine.keywordDensityScore(0.25)).isCloseTo(25.0, within(1e-9));
        assertThat(engine.keywordDensityScore(3.5)).isCloseTo(80.0, within(1e-9));
        assertThat(engine.keywordDensityScore(9.0)).isEqualTo(0.0);
    }

    @Test
    void shouldApplyConfiguredWeights() {
        properties.getScoring().getWeights().setOnPage(1.0);
        properties.getScoring().getWeights().setTechnical(0.0);
        properties.getScoring().getWeights().setContent(0.0);
        properties.getScoring().getWeights().setUx(0.0);
        properties.getScoring().getWeights().setAuthority(0.0);

        ScoringResult result = engine.score(ReportFixtures.weakMeasurement("http://legacy.example.org"));

        assertThat(result.getOverallScore()).isEqualTo(16);
    }
}
