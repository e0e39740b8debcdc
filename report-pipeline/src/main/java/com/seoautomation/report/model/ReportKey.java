package com.seoautomation.report.model;

import java.time.LocalDate;

/**
 * Identity of a report: the tracked URL and the first day of its period.
 */
public record ReportKey(String url, LocalDate periodStart) {

    @Override
    public String toString() {
        return url + "@" + periodStart;
    }
}
