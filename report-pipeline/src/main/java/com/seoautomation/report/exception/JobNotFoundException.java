package com.seoautomation.report.exception;

public class JobNotFoundException extends ReportPipelineException {

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
