package com.seoautomation.report.service;

import com.seoautomation.report.ReportFixtures;
import com.seoautomation.report.model.HistoricalPoint;
import com.seoautomation.report.model.Trend;
import com.seoautomation.report.model.TrendDirection;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrendAnalyzerTest {

    private final TrendAnalyzer analyzer = new TrendAnalyzer(ReportFixtures.properties());

    private static List<HistoricalPoint> scores(double... values) {
        List<HistoricalPoint> points = new ArrayList<>();
        LocalDate start = LocalDate.of(2024, 1, 1);
        for (int i = 0; i < values.length; i++) {
            points.add(new HistoricalPoint(start.plusWeeks(i), values[i], 5, 1, 1000));
        }
        return points;
    }

    @Test
    void shouldComputeSlopeAndDirectionForSteadyGrowth() {
        Trend trend = analyzer.analyze(scores(60, 65, 70, 75));

        assertThat(trend.isHasEnoughData()).isTrue();
        assertThat(trend.getMonthlySlope()).isCloseTo(5.0, within(1e-9));
        assertThat(trend.getScoreDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(trend.getWeeklyChange().score()).isEqualTo(5.0);
        assertThat(trend.getVelocity().score()).isEqualTo(20.0);
        assertThat(trend.getVelocity().acceleration()).isEqualTo(0.0);
        // variance 31.25 over the window
        assertThat(trend.getConfidence()).isCloseTo(0.55, within(1e-9));
    }

    @Test
    void shouldReportInsufficientDataForShortSeries() {
        assertThat(analyzer.analyze(List.of()).isHasEnoughData()).isFalse();
        assertThat(analyzer.analyze(null).isHasEnoughData()).isFalse();

        Trend single = analyzer.analyze(scores(72));
        assertThat(single.isHasEnoughData()).isFalse();
        assertThat(single.getMonthlySlope()).isZero();
        assertThat(single.getVelocity().score()).isZero();
        assertThat(single.getScoreDirection()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void shouldTreatSmallChangesAsStable() {
        Trend trend = analyzer.analyze(scores(70, 72));

        assertThat(trend.getScoreDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(trend.getWeeklyChange().score()).isEqualTo(2.0);
        assertThat(trend.getMonthlySlope()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void shouldDetectDecline() {
        Trend trend = analyzer.analyze(scores(80, 70));

        assertThat(trend.getScoreDirection()).isEqualTo(TrendDirection.DECREASING);
        assertThat(trend.getVelocity().score()).isEqualTo(-40.0);
    }

    @Test
    void shouldClassifyGrowthFromZero() {
        assertThat(analyzer.analyze(scores(0, 10)).getScoreDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(analyzer.analyze(scores(0, 0)).getScoreDirection()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void shouldUseOnlyTheRecentWindowForSlope() {
        Trend trend = analyzer.analyze(scores(10, 90, 20, 60, 65, 70, 75));

        assertThat(trend.getMonthlySlope()).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void shouldComputeAccelerationFromConsecutiveWeeklyChanges() {
        Trend trend = analyzer.analyze(scores(60, 62, 70));

        assertThat(trend.getWeeklyChange().score()).isEqualTo(8.0);
        assertThat(trend.getVelocity().acceleration()).isEqualTo(3.0);
    }

    @Test
    void shouldBoundConfidence() {
        assertThat(analyzer.analyze(scores(60, 62, 70)).getConfidence()).isEqualTo(0.3);
        assertThat(analyzer.analyze(scores(20, 90, 20, 90)).getConfidence()).isEqualTo(0.3);
        assertThat(analyzer.analyze(scores(70, 70, 70, 70)).getConfidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void shouldTrackIssueFixAndTrafficChanges() {
        LocalDate d = LocalDate.of(2024, 1, 1);
        Trend trend = analyzer.analyze(List.of(
                new HistoricalPoint(d, 60, 10, 2, 1000),
                new HistoricalPoint(d.plusWeeks(1), 61, 6, 5, 1200)));

        assertThat(trend.getWeeklyChange().issues()).isEqualTo(-4);
        assertThat(trend.getWeeklyChange().fixes()).isEqualTo(3);
        assertThat(trend.getWeeklyChange().traffic()).isEqualTo(200);
        assertThat(trend.getIssueDirection()).isEqualTo(TrendDirection.DECREASING);
        assertThat(trend.getFixDirection()).isEqualTo(TrendDirection.INCREASING);
    }
}
