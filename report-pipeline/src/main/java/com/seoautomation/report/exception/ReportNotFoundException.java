package com.seoautomation.report.exception;

public class ReportNotFoundException extends ReportPipelineException {

    public ReportNotFoundException(String reportId) {
        super("Report not found: " + reportId);
    }
}
