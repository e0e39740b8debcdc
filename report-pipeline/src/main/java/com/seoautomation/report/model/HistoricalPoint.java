package com.seoautomation.report.model;

import java.time.LocalDate;

/**
 * One entry of the append-only score history kept per tracked URL.
 */
public record HistoricalPoint(LocalDate date, double overallScore, int issueCount, int fixCount, long trafficEstimate) {}
