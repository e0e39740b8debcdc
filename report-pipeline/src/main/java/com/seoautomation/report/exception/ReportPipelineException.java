package com.seoautomation.report.exception;

/**
 * Base type for every failure raised by the report pipeline.
 */
public class ReportPipelineException extends RuntimeException {

    public ReportPipelineException(String message) {
        super(message);
    }

    public ReportPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
