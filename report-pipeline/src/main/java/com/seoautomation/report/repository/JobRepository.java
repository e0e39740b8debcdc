package com.seoautomation.report.repository;

import com.seoautomation.report.model.Job;
import com.seoautomation.report.model.JobStatus;
import com.seoautomation.report.model.ReportKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobRepository {

    Job save(Job job);

    Optional<Job> findById(String jobId);

    /** The pending or processing job for this key, if any. */
    Optional<Job> findActiveByKey(ReportKey key);

    /** Pending jobs in submission order. */
    List<Job> findPending();

    long countByStatus(JobStatus status);

    /** Removes terminal jobs completed before the cutoff and returns how many went. */
    int deleteTerminalBefore(Instant cutoff);
}
