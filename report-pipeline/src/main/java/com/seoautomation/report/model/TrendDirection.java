package com.seoautomation.report.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {
    INCREASING, DECREASING, STABLE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
