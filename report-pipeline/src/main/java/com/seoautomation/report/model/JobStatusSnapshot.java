package com.seoautomation.report.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Read-only view of a job handed to callers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusSnapshot(String jobId, JobStatus status, int progress, String reportId, String error,
                                Instant createdAt, Instant completedAt) {

    public static JobStatusSnapshot of(Job job) {
        return new JobStatusSnapshot(job.getId(), job.getStatus(), job.getProgress(),
                job.getStatus() == JobStatus.COMPLETED ? job.getResultReportId() : null,
                job.getError(), job.getCreatedAt(), job.getCompletedAt());
    }
}
