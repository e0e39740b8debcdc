package com.seoautomation.report.exception;

import java.util.List;

/**
 * A raw measurement has an impossible shape. Fails the job and is reported verbatim.
 */
public class MeasurementValidationException extends ReportPipelineException {

    private final List<String> violations;

    public MeasurementValidationException(List<String> violations) {
        super("Invalid measurement: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
