package com.seoautomation.report.service;

import com.seoautomation.report.model.Report;

import java.util.List;

/**
 * Supplies competitor snapshots for the comparisons section of a report.
 */
public interface CompetitorComparisonProvider {

    List<Report.CompetitorSnapshot> competitorsFor(String url, int overallScore);
}
