package com.seoautomation.report.exception;

public class UnsupportedExportFormatException extends ReportPipelineException {

    public UnsupportedExportFormatException(String format) {
        super("Unsupported export format: " + format
                + " (expected structured-json, tabular-csv or portable-document)");
    }
}
