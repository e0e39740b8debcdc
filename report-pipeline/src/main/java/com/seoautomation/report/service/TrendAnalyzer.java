package com.seoautomation.report.service;

import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.model.HistoricalPoint;
import com.seoautomation.report.model.Trend;
import com.seoautomation.report.model.TrendDirection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads a score series (oldest first, current period last) and derives week-over-week
 * change, the least-squares slope of the recent window, direction labels, a naive
 * monthly velocity and a variance-based confidence.
 *
 * Fewer than two points is a valid outcome: {@link Trend#insufficient()}.
 */
@Service
@RequiredArgsConstructor
public class TrendAnalyzer {

    private final ReportPipelineProperties properties;

    public Trend analyze(List<HistoricalPoint> series) {
        if (series == null || series.size() < 2) {
            return Trend.insufficient();
        }
        ReportPipelineProperties.TrendSettings t = properties.getTrend();
        int n = series.size();
        HistoricalPoint current = series.get(n - 1);
        HistoricalPoint previous = series.get(n - 2);

        Trend.WeeklyChange weeklyChange = new Trend.WeeklyChange(
                current.overallScore() - previous.overallScore(),
                current.issueCount() - previous.issueCount(),
                current.fixCount() - previous.fixCount(),
                current.trafficEstimate() - previous.trafficEstimate());

        List<HistoricalPoint> window = series.subList(Math.max(0, n - t.getSlopeWindow()), n);
        double[] scores = window.stream().mapToDouble(HistoricalPoint::overallScore).toArray();

        double acceleration = 0;
        if (n >= 3) {
            double earlierChange = previous.overallScore() - series.get(n - 3).overallScore();
            acceleration = (weeklyChange.score() - earlierChange) / 2;
        }

        return Trend.builder()
                .hasEnoughData(true)
                .weeklyChange(weeklyChange)
                .monthlySlope(slope(scores))
                .scoreDirection(direction(previous.overallScore(), current.overallScore()))
                .issueDirection(direction(previous.issueCount(), current.issueCount()))
                .fixDirection(direction(previous.fixCount(), current.fixCount()))
                .velocity(new Trend.Velocity(weeklyChange.score() * t.getVelocityMultiplier(), acceleration))
                .confidence(confidence(series))
                .build();
    }

    /**
     * Ordinary least-squares slope of the values against their index 0..n-1.
     */
    double slope(double[] y) {
        int n = y.length;
        if (n < 2) return 0;

        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int x = 0; x < n; x++) {
            sumX += x;
            sumY += y[x];
            sumXY += x * y[x];
            sumX2 += (double) x * x;
        }
        return (n * sumXY - sumX * sumY) / (n * sumX2 - sumX * sumX);
    }

    /**
     * Within the stable band (percent of the previous value) the series is flat.
     */
    TrendDirection direction(double previous, double recent) {
        if (previous == 0) {
            if (recent == 0) return TrendDirection.STABLE;
            return recent > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        }
        double change = (recent - previous) / Math.abs(previous) * 100;
        if (Math.abs(change) < properties.getTrend().getStableBandPercent()) {
            return TrendDirection.STABLE;
        }
        return change > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }

    double confidence(List<HistoricalPoint> series) {
        ReportPipelineProperties.TrendSettings t = properties.getTrend();
        int window = t.getSlopeWindow();
        if (series.size() < window) {
            return t.getMinConfidence();
        }
        double[] recent = series.subList(series.size() - window, series.size()).stream()
                .mapToDouble(HistoricalPoint::overallScore)
                .toArray();
        double consistency = 1 - variance(recent) / 100;
        return Math.max(t.getMinConfidence(), Math.min(t.getMaxConfidence(), consistency * t.getConfidenceScale()));
    }

    private double variance(double[] values) {
        double mean = 0;
        for (double v : values) mean += v;
        mean /= values.length;

        double sq = 0;
        for (double v : values) sq += (v - mean) * (v - mean);
        return sq / values.length;
    }
}
