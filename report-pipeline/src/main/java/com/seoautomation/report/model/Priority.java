package com.seoautomation.report.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Recommendation priority; declaration order is ranking order. */
public enum Priority {
    HIGH, MEDIUM, LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
