package com.seoautomation.report.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of a submit: either an existing report (cache hit) or the id of the job
 * that will produce it.
 */
public record SubmitResult(String jobId, long estimatedSeconds, boolean deduplicated,
                           @JsonIgnore Report existingReport) {

    public static SubmitResult existing(Report report) {
        return new SubmitResult(null, 0, false, report);
    }

    public static SubmitResult queued(Job job, boolean deduplicated) {
        return new SubmitResult(job.getId(), job.getEstimatedSeconds(), deduplicated, null);
    }

    @JsonIgnore
    public boolean isCacheHit() {
        return existingReport != null;
    }
}
