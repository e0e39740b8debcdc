package com.seoautomation.report.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScoreCategory {

    ON_PAGE("onPage", "On-page SEO"),
    TECHNICAL("technical", "Technical SEO"),
    CONTENT("content", "Content quality"),
    UX("ux", "User experience"),
    AUTHORITY("authority", "Authority");

    private final String key;
    private final String label;

    ScoreCategory(String key, String label) {
        this.key = key;
        this.label = label;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String label() {
        return label;
    }
}
