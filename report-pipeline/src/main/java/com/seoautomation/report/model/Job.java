package com.seoautomation.report.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Tracks one report generation request. Only the scheduler mutates a job, and only
 * one worker owns it at a time.
 */
@Data
@Builder
public class Job {

    private String id;
    private String url;
    private LocalDate periodStart;
    private JobStatus status;
    private int progress;            // 0..100
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private long estimatedSeconds;
    private String error;            // null unless failed or cancelled
    private String resultReportId;   // set on completion

    public ReportKey key() {
        return new ReportKey(url, periodStart);
    }
}
