package com.seoautomation.report.repository;

import com.seoautomation.report.model.HistoricalPoint;

import java.time.LocalDate;
import java.util.List;

/**
 * Append-only score history per tracked URL.
 */
public interface HistoryStore {

    /** The most recent {@code limit} points for the url, oldest first. */
    List<HistoricalPoint> getHistory(String url, int limit);

    /** The most recent {@code limit} points dated strictly before {@code before}, oldest first. */
    List<HistoricalPoint> getHistoryBefore(String url, LocalDate before, int limit);

    /** Appends a point. A second point for the same date is ignored. */
    void append(String url, HistoricalPoint point);
}
