package com.seoautomation.report.output;

import com.seoautomation.report.model.Report;

public interface ReportExporter {

    ExportFormat format();

    /** Renders the report. Never modifies it. */
    byte[] export(Report report);
}
