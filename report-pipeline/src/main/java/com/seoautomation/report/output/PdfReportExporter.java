package com.seoautomation.report.output;

import com.seoautomation.report.exception.ReportPipelineException;
import com.seoautomation.report.model.CategoryScore;
import com.seoautomation.report.model.Issue;
import com.seoautomation.report.model.Recommendation;
import com.seoautomation.report.model.Report;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain text layout of the report on A4 pages using the standard Helvetica fonts.
 */
@Component
@Slf4j
public class PdfReportExporter implements ReportExporter {

    private static final float MARGIN = 50;
    private static final float LEADING = 14;
    private static final float BODY_SIZE = 10;
    private static final float HEADING_SIZE = 13;
    private static final int WRAP_COLUMNS = 95;
    private static final int HEADING_WRAP_COLUMNS = 70;
    private static final String CONTINUATION = "    ";

    @Override
    public ExportFormat format() {
        return ExportFormat.PORTABLE_DOCUMENT;
    }

    @Override
    public byte[] export(Report report) {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            new PageWriter(document).write(lines(report));
            document.save(out);
            return out.toByteArray();

        } catch (IOException e) {
            log.error("Failed to render PDF for report {}: {}", report.getId(), e.getMessage(), e);
            throw new ReportPipelineException("PDF export failed for report " + report.getId(), e);
        }
    }

    // ── Layout ───────────────────────────────────────────────────────────────

    private record Line(String text, boolean heading) {}

    private List<Line> lines(Report report) {
        List<Line> lines = new ArrayList<>();
        heading(lines, "SEO Report: " + report.getUrl());
        body(lines, "Period: " + report.getPeriodStart() + " to " + report.getPeriodEnd());
        body(lines, "Overall score: " + report.getOverallScore() + " (" + report.getGrade() + ", "
                + report.getStatus() + ", " + report.getDirection() + ")");

        heading(lines, "Category scores");
        for (CategoryScore cs : report.getCategoryScores().values()) {
            body(lines, cs.getCategory().label() + ": " + cs.getScore() + (cs.isDefaulted() ? " (defaulted)" : ""));
        }

        heading(lines, "Issues (" + report.getIssues().size() + ")");
        for (Issue issue : report.getIssueSummary().top()) {
            body(lines, "[" + issue.getSeverity().name() + "] " + issue.getMessage() + " - " + issue.getRemediation());
        }

        heading(lines, "Recommendations");
        for (Recommendation rec : report.getRecommendations()) {
            body(lines, rec.getPriority().name() + ": " + rec.getTitle() + " (impact " + rec.getEstimatedImpact()
                    + ", effort " + rec.getEstimatedEffort().value() + ")");
            for (String step : rec.getSteps()) {
                body(lines, "  - " + step);
            }
        }

        heading(lines, "Trend and forecast");
        if (report.getTrend().isHasEnoughData()) {
            body(lines, "Weekly change: " + report.getTrend().getWeeklyChange().score()
                    + ", monthly slope: " + report.getTrend().getMonthlySlope());
        } else {
            body(lines, "Not enough history for trend analysis");
        }
        body(lines, "Forecast (" + report.getForecast().getTimeframe() + "): " + report.getForecast().getPredictedScore()
                + " at confidence " + report.getForecast().getConfidence());

        heading(lines, "Insights");
        report.getActionableInsights().forEach(i -> body(lines, "- " + i));
        report.getNarrative().strengths().forEach(s -> body(lines, "Strength: " + s));
        report.getNarrative().weaknesses().forEach(w -> body(lines, "Weakness: " + w));
        return lines;
    }

    private void heading(List<Line> lines, String text) {
        wrap(sanitize(text), HEADING_WRAP_COLUMNS).forEach(part -> lines.add(new Line(part, true)));
    }

    private void body(List<Line> lines, String text) {
        wrap(sanitize(text), WRAP_COLUMNS).forEach(part -> lines.add(new Line(part, false)));
    }

    /** Splits at the last space before {@code columns}, or hard at {@code columns} when there is none. */
    static List<String> wrap(String text, int columns) {
        List<String> parts = new ArrayList<>();
        String rest = text;
        int indent = 0;
        while (rest.length() > columns) {
            int cut = rest.lastIndexOf(' ', columns);
            // never break inside the continuation indent
            if (cut <= indent) cut = columns;
            parts.add(rest.substring(0, cut));
            rest = CONTINUATION + rest.substring(cut).trim();
            indent = CONTINUATION.length();
        }
        parts.add(rest);
        return parts;
    }

    /** Standard 14 fonts only cover Latin-1. */
    static String sanitize(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            sb.append((c >= 32 && c < 127) || (c >= 160 && c <= 255) ? c : '?');
        }
        return sb.toString();
    }

    private static final class PageWriter {

        private final PDDocument document;
        private final PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        private final PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        private PDPageContentStream stream;
        private float y;

        PageWriter(PDDocument document) {
            this.document = document;
        }

        void write(List<Line> lines) throws IOException {
            newPage();
            try {
                for (Line line : lines) {
                    if (y < MARGIN + LEADING) {
                        stream.close();
                        newPage();
                    }
                    if (line.heading()) {
                        y -= LEADING / 2;
                    }
                    stream.beginText();
                    stream.setFont(line.heading() ? bold : regular, line.heading() ? HEADING_SIZE : BODY_SIZE);
                    stream.newLineAtOffset(MARGIN, y);
                    stream.showText(line.text());
                    stream.endText();
                    y -= LEADING;
                }
            } finally {
                stream.close();
            }
        }

        private void newPage() throws IOException {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            y = page.getMediaBox().getHeight() - MARGIN;
        }
    }
}
