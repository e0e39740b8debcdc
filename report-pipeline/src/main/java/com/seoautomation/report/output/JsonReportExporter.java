package com.seoautomation.report.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seoautomation.report.exception.ReportPipelineException;
import com.seoautomation.report.model.Report;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Full report as pretty-printed JSON, including trend, forecast and narrative.
 */
@Component
@RequiredArgsConstructor
public class JsonReportExporter implements ReportExporter {

    private final ObjectMapper objectMapper;

    @Override
    public ExportFormat format() {
        return ExportFormat.STRUCTURED_JSON;
    }

    @Override
    public byte[] export(Report report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            throw new ReportPipelineException("JSON export failed for report " + report.getId(), e);
        }
    }
}
