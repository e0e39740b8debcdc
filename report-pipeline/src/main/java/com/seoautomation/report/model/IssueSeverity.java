package com.seoautomation.report.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IssueSeverity {
    CRITICAL, WARNING, INFO;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
