package com.seoautomation.report.exception;

/**
 * The pending queue is full. Callers should back off and submit again later.
 */
public class SchedulerOverloadException extends ReportPipelineException {

    private final long retryAfterSeconds;

    public SchedulerOverloadException(int queued, long retryAfterSeconds) {
        super("Report queue is full (" + queued + " pending jobs), retry in " + retryAfterSeconds + "s");
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
