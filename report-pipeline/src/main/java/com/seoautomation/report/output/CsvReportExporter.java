package com.seoautomation.report.output;

import com.opencsv.CSVWriter;
import com.seoautomation.report.exception.ReportPipelineException;
import com.seoautomation.report.model.CategoryScore;
import com.seoautomation.report.model.Issue;
import com.seoautomation.report.model.Recommendation;
import com.seoautomation.report.model.Report;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Flattens a report into {@code Section,Metric,Value} rows: summary, scores, issues,
 * recommendations, trend, forecast and extracted metrics.
 */
@Component
@Slf4j
public class CsvReportExporter implements ReportExporter {

    private static final String[] HEADERS = {"Section", "Metric", "Value"};

    @Override
    public ExportFormat format() {
        return ExportFormat.TABULAR_CSV;
    }

    @Override
    public byte[] export(Report report) {
        StringWriter out = new StringWriter();

        try (CSVWriter writer = new CSVWriter(
                out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);

            writer.writeNext(row("Summary", "URL", report.getUrl()));
            writer.writeNext(row("Summary", "Period Start", report.getPeriodStart()));
            writer.writeNext(row("Summary", "Period End", report.getPeriodEnd()));
            writer.writeNext(row("Summary", "Overall Score", report.getOverallScore()));
            writer.writeNext(row("Summary", "Grade", report.getGrade()));
            writer.writeNext(row("Summary", "Status", report.getStatus()));
            writer.writeNext(row("Summary", "Direction", report.getDirection()));

            for (CategoryScore cs : report.getCategoryScores().values()) {
                writer.writeNext(row("Scores", cs.getCategory().label(), cs.getScore()));
            }

            for (Issue issue : report.getIssues()) {
                writer.writeNext(row("Issues", issue.getSeverity().value() + "/" + issue.getType(),
                        issue.getMessage()));
            }

            for (Recommendation rec : report.getRecommendations()) {
                writer.writeNext(row("Recommendations", rec.getPriority().value(),
                        rec.getTitle() + " (impact " + rec.getEstimatedImpact() + ")"));
            }

            writer.writeNext(row("Trend", "Weekly Change", report.getTrend().getWeeklyChange().score()));
            writer.writeNext(row("Trend", "Monthly Slope", report.getTrend().getMonthlySlope()));
            writer.writeNext(row("Trend", "Confidence", report.getTrend().getConfidence()));

            writer.writeNext(row("Forecast", "Predicted Score", report.getForecast().getPredictedScore()));
            writer.writeNext(row("Forecast", "Confidence", report.getForecast().getConfidence()));
            writer.writeNext(row("Forecast", "Timeframe", report.getForecast().getTimeframe()));

            for (Map.Entry<String, Map<String, Object>> section : report.getMetrics().entrySet()) {
                for (Map.Entry<String, Object> metric : section.getValue().entrySet()) {
                    writer.writeNext(row("Metrics", section.getKey() + "." + metric.getKey(), metric.getValue()));
                }
            }

        } catch (IOException e) {
            log.error("Failed to write CSV for report {}: {}", report.getId(), e.getMessage(), e);
            throw new ReportPipelineException("CSV export failed for report " + report.getId(), e);
        }

        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String[] row(String section, String metric, Object value) {
        return new String[]{section, metric, str(value)};
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
