package com.seoautomation.report.output;

import com.seoautomation.report.exception.UnsupportedExportFormatException;
import com.seoautomation.report.model.Report;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes an export request to the exporter registered for the format.
 */
@Component
@Slf4j
public class ExportRouter {

    private final Map<ExportFormat, ReportExporter> exporters = new EnumMap<>(ExportFormat.class);

    public ExportRouter(List<ReportExporter> exporters) {
        exporters.forEach(e -> this.exporters.put(e.format(), e));
    }

    public ExportedReport export(Report report, ExportFormat format) {
        ReportExporter exporter = exporters.get(format);
        if (exporter == null) {
            throw new UnsupportedExportFormatException(format.value());
        }
        byte[] content = exporter.export(report);
        log.info("Exported report {} as {} ({} bytes)", report.getId(), format.value(), content.length);
        return new ExportedReport(content, format.contentType(), fileName(report, format));
    }

    static String fileName(Report report, ExportFormat format) {
        String host = report.getUrl().replaceFirst("^https?://", "").replaceAll("[^A-Za-z0-9.-]", "_");
        return String.format("seo-report_%s_%s.%s", host, report.getPeriodStart(), format.extension());
    }
}
