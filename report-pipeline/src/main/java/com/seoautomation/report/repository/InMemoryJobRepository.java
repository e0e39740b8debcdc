package com.seoautomation.report.repository;

import com.seoautomation.report.model.Job;
import com.seoautomation.report.model.JobStatus;
import com.seoautomation.report.model.ReportKey;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Insertion-ordered job table. Iteration order is submission order, which the
 * dispatcher relies on for FIFO pickup.
 */
@Repository
public class InMemoryJobRepository implements JobRepository {

    private final Map<String, Job> jobs = new LinkedHashMap<>();

    @Override
    public synchronized Job save(Job job) {
        jobs.put(job.getId(), job);
        return job;
    }

    @Override
    public synchronized Optional<Job> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized Optional<Job> findActiveByKey(ReportKey key) {
        return jobs.values().stream()
                .filter(j -> j.getStatus().isActive() && j.key().equals(key))
                .findFirst();
    }

    @Override
    public synchronized List<Job> findPending() {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.PENDING)
                .toList();
    }

    @Override
    public synchronized long countByStatus(JobStatus status) {
        return jobs.values().stream().filter(j -> j.getStatus() == status).count();
    }

    @Override
    public synchronized int deleteTerminalBefore(Instant cutoff) {
        int before = jobs.size();
        jobs.values().removeIf(j -> j.getStatus().isTerminal()
                && j.getCompletedAt() != null
                && j.getCompletedAt().isBefore(cutoff));
        return before - jobs.size();
    }
}
