package com.seoautomation.report.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Reporting window, start inclusive and end exclusive. Reports are weekly.
 */
public record ReportPeriod(LocalDate start, LocalDate end) {

    public static ReportPeriod weekOf(LocalDate start) {
        return new ReportPeriod(start, start.plusWeeks(1));
    }

    /** The week (Monday start) containing the given day. */
    public static ReportPeriod weekContaining(LocalDate day) {
        return weekOf(day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)));
    }
}
