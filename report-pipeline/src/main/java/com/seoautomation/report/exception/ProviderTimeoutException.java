package com.seoautomation.report.exception;

import java.time.Duration;

/**
 * The metric collector did not answer within its time bound. Fails the current job only.
 */
public class ProviderTimeoutException extends ReportPipelineException {

    public ProviderTimeoutException(String url, Duration timeout) {
        super("Metric collection for " + url + " timed out after " + timeout.toSeconds() + "s");
    }

    public ProviderTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
