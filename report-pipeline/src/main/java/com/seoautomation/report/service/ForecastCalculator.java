package com.seoautomation.report.service;

import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.model.Forecast;
import com.seoautomation.report.model.Recommendation;
import com.seoautomation.report.model.Trend;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Projects the overall score one timeframe ahead from trend velocity and the
 * expected effect of acting on the recommendations.
 *
 * predicted  = clamp(0, 100, current + 0.25 * velocity + 2 * recommendationImpact)
 * confidence = clamp(0.3, 0.9, 0.5 + 0.3 * trendConfidence - 0.02 * issueCount)
 *
 * Without enough history the current score is carried forward at confidence 0.5.
 */
@Service
@RequiredArgsConstructor
public class ForecastCalculator {

    static final String INSUFFICIENT_HISTORY = "Historical data insufficient for accurate forecast";

    private final ReportPipelineProperties properties;

    public Forecast forecast(int currentScore, Trend trend, List<Recommendation> recommendations, int issueCount) {
        ReportPipelineProperties.ForecastSettings f = properties.getForecast();

        if (trend == null || !trend.isHasEnoughData()) {
            return Forecast.builder()
                    .predictedScore(currentScore)
                    .confidence(0.5)
                    .timeframe(f.getTimeframe())
                    .bestCase(bestCase(currentScore))
                    .worstCase(worstCase(currentScore))
                    .basedOnHistory(false)
                    .note(INSUFFICIENT_HISTORY)
                    .build();
        }

        double predicted = clamp(0, 100,
                currentScore + trend.getVelocity().score() * f.getVelocityFactor() + f.getRecommendationImpact() * 2);

        ReportPipelineProperties.TrendSettings t = properties.getTrend();
        double confidence = clamp(t.getMinConfidence(), t.getMaxConfidence(),
                0.5 + trend.getConfidence() * 0.3 - issueCount * f.getIssuePenalty());

        return Forecast.builder()
                .predictedScore((int) Math.round(predicted))
                .confidence(Math.round(confidence * 100) / 100.0)
                .timeframe(f.getTimeframe())
                .bestCase(bestCase(predicted))
                .worstCase(worstCase(predicted))
                .basedOnHistory(true)
                .keyDriver("Current trend velocity")
                .keyDriver(recommendations.isEmpty()
                        ? "No outstanding recommendations"
                        : recommendations.size() + " recommended improvements")
                .keyDriver("Issue resolution rate")
                .build();
    }

    private double bestCase(double predicted) {
        return ScoringEngine.round1(Math.min(100, predicted * properties.getForecast().getBestCaseMultiplier()));
    }

    private double worstCase(double predicted) {
        return ScoringEngine.round1(Math.max(0, predicted * properties.getForecast().getWorstCaseMultiplier()));
    }

    private double clamp(double min, double max, double value) {
        return Math.max(min, Math.min(max, value));
    }
}
