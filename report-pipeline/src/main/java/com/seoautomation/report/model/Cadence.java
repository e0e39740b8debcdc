package com.seoautomation.report.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;

public enum Cadence {
    DAILY, WEEKLY, MONTHLY;

    public Instant next(Instant from) {
        return switch (this) {
            case DAILY -> from.atZone(ZoneOffset.UTC).plusDays(1).toInstant();
            case WEEKLY -> from.atZone(ZoneOffset.UTC).plusWeeks(1).toInstant();
            case MONTHLY -> from.atZone(ZoneOffset.UTC).plusMonths(1).toInstant();
        };
    }

    @JsonCreator
    public static Cadence fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("cadence is required");
        }
        try {
            return Cadence.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("cadence must be one of daily, weekly, monthly: " + value);
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
