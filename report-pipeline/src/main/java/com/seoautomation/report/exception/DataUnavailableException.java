package com.seoautomation.report.exception;

/**
 * A provider returned nothing for one measurement section. Never fails a run:
 * the section is dropped and scoring applies its default.
 */
public class DataUnavailableException extends ReportPipelineException {

    private final String section;

    public DataUnavailableException(String section, String message) {
        super(message);
        this.section = section;
    }

    public String getSection() {
        return section;
    }
}
