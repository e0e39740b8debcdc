package com.seoautomation.report.service;

import com.seoautomation.report.collector.MetricCollector;
import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.exception.ProviderTimeoutException;
import com.seoautomation.report.exception.ReportPipelineException;
import com.seoautomation.report.model.Forecast;
import com.seoautomation.report.model.HistoricalPoint;
import com.seoautomation.report.model.RawMeasurement;
import com.seoautomation.report.model.Recommendation;
import com.seoautomation.report.model.Report;
import com.seoautomation.report.model.ReportPeriod;
import com.seoautomation.report.model.ScoringResult;
import com.seoautomation.report.model.Trend;
import com.seoautomation.report.repository.HistoryStore;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Runs the stages for one (url, period): collect, score, trend, recommend, forecast,
 * compile. Stages run in order and each one only sees finished outputs of the stages
 * before it.
 *
 * Nothing is persisted here. The caller stores the report and then appends the
 * returned history point, so a failed run leaves no trace.
 */
@Service
@Slf4j
public class ReportPipeline {

    /** Receives stage progress (0..100). May throw to abort the run. */
    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(int percent);

        ProgressListener NONE = percent -> { };
    }

    public record Result(Report report, HistoricalPoint currentPoint) {}

    private final MetricCollector metricCollector;
    private final ScoringEngine scoringEngine;
    private final TrendAnalyzer trendAnalyzer;
    private final RecommendationGenerator recommendationGenerator;
    private final ForecastCalculator forecastCalculator;
    private final ReportCompiler reportCompiler;
    private final HistoryStore historyStore;
    private final TimeLimiter collectorTimeLimiter;
    private final Executor collectorExecutor;
    private final ReportPipelineProperties properties;

    public ReportPipeline(MetricCollector metricCollector,
                          ScoringEngine scoringEngine,
                          TrendAnalyzer trendAnalyzer,
                          RecommendationGenerator recommendationGenerator,
                          ForecastCalculator forecastCalculator,
                          ReportCompiler reportCompiler,
                          HistoryStore historyStore,
                          TimeLimiter collectorTimeLimiter,
                          @Qualifier("collectorExecutor") Executor collectorExecutor,
                          ReportPipelineProperties properties) {
        this.metricCollector = metricCollector;
        this.scoringEngine = scoringEngine;
        this.trendAnalyzer = trendAnalyzer;
        this.recommendationGenerator = recommendationGenerator;
        this.forecastCalculator = forecastCalculator;
        this.reportCompiler = reportCompiler;
        this.historyStore = historyStore;
        this.collectorTimeLimiter = collectorTimeLimiter;
        this.collectorExecutor = collectorExecutor;
        this.properties = properties;
    }

    public Result run(String url, ReportPeriod period, ProgressListener progress) {
        long start = System.currentTimeMillis();
        log.info("Generating report for {} (period {} to {})", url, period.start(), period.end());

        progress.onProgress(10);
        RawMeasurement measurement = collect(url);

        progress.onProgress(30);
        ScoringResult scoring = scoringEngine.score(measurement);
        if (!scoring.getDefaultedInputs().isEmpty()) {
            log.warn("Scored {} with defaulted inputs: {}", url, scoring.getDefaultedInputs());
        }

        progress.onProgress(50);
        List<HistoricalPoint> prior = historyStore.getHistoryBefore(url, period.start(),
                properties.getScheduler().getHistoryWindow());
        HistoricalPoint current = currentPoint(period, scoring, prior);
        List<HistoricalPoint> series = new ArrayList<>(prior);
        series.add(current);
        Trend trend = trendAnalyzer.analyze(series);

        progress.onProgress(65);
        List<Recommendation> recommendations = recommendationGenerator.generate(scoring, trend);

        progress.onProgress(80);
        Forecast forecast = forecastCalculator.forecast(scoring.getOverallScore(), trend, recommendations,
                scoring.getIssues().size());

        progress.onProgress(95);
        Report report = reportCompiler.compile(new ReportCompiler.Inputs(url, period, scoring, List.copyOf(series),
                trend, recommendations, forecast));

        log.info("Report {} for {} compiled in {}ms: score={} grade={} issues={} recommendations={}",
                report.getId(), url, System.currentTimeMillis() - start, report.getOverallScore(),
                report.getGrade(), report.getIssues().size(), recommendations.size());
        return new Result(report, current);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Fix count and traffic are not measured by the collector; they carry forward from
     * the latest recorded point.
     */
    private HistoricalPoint currentPoint(ReportPeriod period, ScoringResult scoring, List<HistoricalPoint> prior) {
        HistoricalPoint last = prior.isEmpty() ? null : prior.get(prior.size() - 1);
        return new HistoricalPoint(period.start(), scoring.getOverallScore(), scoring.getIssues().size(),
                last == null ? 0 : last.fixCount(),
                last == null ? 0 : last.trafficEstimate());
    }

    private RawMeasurement collect(String url) {
        try {
            return collectorTimeLimiter.executeFutureSupplier(() ->
                    CompletableFuture.supplyAsync(() -> metricCollector.fetchMeasurement(url), collectorExecutor));

        } catch (TimeoutException e) {
            Duration timeout = collectorTimeLimiter.getTimeLimiterConfig().getTimeoutDuration();
            log.warn("Measurement collection for {} timed out after {}", url, timeout);
            throw new ProviderTimeoutException(url, timeout);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReportPipelineException("Interrupted while collecting measurements for " + url, e);

        } catch (ReportPipelineException e) {
            throw e;

        } catch (CompletionException | ExecutionException e) {
            if (e.getCause() instanceof ReportPipelineException rpe) {
                throw rpe;
            }
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ReportPipelineException("Measurement collection failed for " + url + ": " + cause.getMessage(), e);

        } catch (Exception e) {
            throw new ReportPipelineException("Measurement collection failed for " + url + ": " + e.getMessage(), e);
        }
    }
}
