package com.seoautomation.report.scheduler;

import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.exception.JobNotFoundException;
import com.seoautomation.report.exception.SchedulerOverloadException;
import com.seoautomation.report.model.Job;
import com.seoautomation.report.model.JobStatus;
import com.seoautomation.report.model.JobStatusSnapshot;
import com.seoautomation.report.model.Report;
import com.seoautomation.report.model.ReportKey;
import com.seoautomation.report.model.ReportPeriod;
import com.seoautomation.report.model.SubmitResult;
import com.seoautomation.report.repository.HistoryStore;
import com.seoautomation.report.repository.JobRepository;
import com.seoautomation.report.repository.ReportRepository;
import com.seoautomation.report.service.ReportPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;

/**
 * Queues report jobs and runs them on a bounded worker pool.
 *
 * At most one active job exists per (url, period start); a repeat submit gets the same
 * job id back, and a submit for a period that already has a report gets that report.
 * Every job state change happens under {@code lock}, so a status read never sees a
 * completed job whose report is not yet stored.
 *
 * Worker slots are tracked in {@code running}. A cancelled job gives its slot back
 * immediately even if its thread is still unwinding.
 */
@Component
@Slf4j
public class ReportJobScheduler {

    private final ReportPipeline pipeline;
    private final JobRepository jobRepository;
    private final ReportRepository reportRepository;
    private final HistoryStore historyStore;
    private final AsyncTaskExecutor workerExecutor;
    private final ReportPipelineProperties properties;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, Future<?>> running = new HashMap<>();

    public ReportJobScheduler(ReportPipeline pipeline,
                              JobRepository jobRepository,
                              ReportRepository reportRepository,
                              HistoryStore historyStore,
                              @Qualifier("reportWorkerExecutor") AsyncTaskExecutor workerExecutor,
                              ReportPipelineProperties properties,
                              Clock clock) {
        this.pipeline = pipeline;
        this.jobRepository = jobRepository;
        this.reportRepository = reportRepository;
        this.historyStore = historyStore;
        this.workerExecutor = workerExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    // ── Submission ───────────────────────────────────────────────────────────

    public SubmitResult submit(String url, LocalDate periodStart) {
        validate(url, periodStart);
        ReportKey key = new ReportKey(url, periodStart);
        Job job;

        synchronized (lock) {
            Optional<Report> existing = reportRepository.findByKey(key);
            if (existing.isPresent()) {
                log.info("Report for {} already exists: {}", key, existing.get().getId());
                return SubmitResult.existing(existing.get());
            }

            Optional<Job> active = jobRepository.findActiveByKey(key);
            if (active.isPresent()) {
                log.info("Job {} already active for {}, returning it", active.get().getId(), key);
                return SubmitResult.queued(active.get(), true);
            }

            ReportPipelineProperties.Scheduler s = properties.getScheduler();
            long pending = jobRepository.countByStatus(JobStatus.PENDING);
            if (pending >= s.getMaxQueueSize()) {
                log.warn("Rejecting job for {}: {} jobs already pending", key, pending);
                throw new SchedulerOverloadException((int) pending, s.getEstimatedSecondsPerJob());
            }

            long ahead = pending + running.size();
            job = Job.builder()
                    .id(UUID.randomUUID().toString())
                    .url(url)
                    .periodStart(periodStart)
                    .status(JobStatus.PENDING)
                    .progress(0)
                    .createdAt(Instant.now(clock))
                    .estimatedSeconds(s.getEstimatedSecondsPerJob() * (1 + ahead / s.getMaxWorkers()))
                    .build();
            jobRepository.save(job);
        }

        log.info("Queued job {} for {} (estimated {}s)", job.getId(), key, job.getEstimatedSeconds());
        dispatch();
        return SubmitResult.queued(job, false);
    }

    public JobStatusSnapshot status(String jobId) {
        synchronized (lock) {
            return JobStatusSnapshot.of(find(jobId));
        }
    }

    /**
     * Cancels a pending or processing job. Returns false when the job had already
     * finished.
     */
    public boolean cancel(String jobId) {
        synchronized (lock) {
            Job job = find(jobId);
            if (job.getStatus().isTerminal()) {
                log.info("Job {} already {}, nothing to cancel", jobId, job.getStatus().value());
                return false;
            }
            finish(job, JobStatus.CANCELLED, "Cancelled by request");
            Future<?> future = running.remove(jobId);
            if (future != null) {
                future.cancel(true);
            }
        }
        log.info("Cancelled job {}", jobId);
        dispatch();
        return true;
    }

    // ── Dispatch ─────────────────────────────────────────────────────────────

    /**
     * Starts pending jobs in submission order while worker slots are free.
     */
    @Scheduled(fixedDelayString = "${seo-report.scheduler.poll-interval-ms:1000}")
    public void dispatch() {
        synchronized (lock) {
            int maxWorkers = properties.getScheduler().getMaxWorkers();
            for (Job job : jobRepository.findPending()) {
                if (running.size() >= maxWorkers) {
                    break;
                }
                if (job.getStatus() != JobStatus.PENDING) {
                    continue;
                }
                job.setStatus(JobStatus.PROCESSING);
                job.setStartedAt(Instant.now(clock));
                jobRepository.save(job);
                try {
                    running.put(job.getId(), workerExecutor.submit(() -> execute(job)));
                    log.debug("Started job {} ({} of {} workers busy)", job.getId(), running.size(), maxWorkers);
                } catch (TaskRejectedException e) {
                    log.error("Worker pool rejected job {}: {}", job.getId(), e.getMessage());
                    finish(job, JobStatus.FAILED, "Worker pool rejected job: " + e.getMessage());
                }
            }
        }
    }

    public int activeWorkers() {
        synchronized (lock) {
            return running.size();
        }
    }

    /**
     * Drops finished jobs older than the retention window.
     */
    @Scheduled(fixedDelayString = "${seo-report.scheduler.prune-interval-ms:3600000}")
    public void pruneFinishedJobs() {
        Instant cutoff = Instant.now(clock).minus(Duration.ofHours(properties.getScheduler().getJobRetentionHours()));
        int removed;
        synchronized (lock) {
            removed = jobRepository.deleteTerminalBefore(cutoff);
        }
        if (removed > 0) {
            log.info("Pruned {} finished jobs older than {}", removed, cutoff);
        }
    }

    // ── Worker ───────────────────────────────────────────────────────────────

    void execute(Job job) {
        try {
            ReportPipeline.Result result = pipeline.run(job.getUrl(), ReportPeriod.weekOf(job.getPeriodStart()),
                    percent -> updateProgress(job, percent));

            synchronized (lock) {
                if (job.getStatus() != JobStatus.PROCESSING) {
                    log.info("Discarding result of job {} ({})", job.getId(), job.getStatus().value());
                    return;
                }
                Report stored = reportRepository.save(result.report());
                job.setResultReportId(stored.getId());
                job.setProgress(100);
                finish(job, JobStatus.COMPLETED, null);
            }
            log.info("Job {} completed: report {}", job.getId(), job.getResultReportId());
            appendHistory(job, result);

        } catch (CancellationException e) {
            log.info("Job {} stopped: {}", job.getId(), e.getMessage());

        } catch (Exception e) {
            synchronized (lock) {
                if (job.getStatus() == JobStatus.PROCESSING) {
                    finish(job, JobStatus.FAILED, e.getMessage());
                }
            }
            log.error("Job {} failed for {}: {}", job.getId(), job.key(), e.getMessage(), e);

        } finally {
            synchronized (lock) {
                running.remove(job.getId());
            }
            dispatch();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void updateProgress(Job job, int percent) {
        synchronized (lock) {
            if (job.getStatus() != JobStatus.PROCESSING) {
                throw new CancellationException("Job " + job.getId() + " is " + job.getStatus().value());
            }
            if (percent > job.getProgress()) {
                job.setProgress(percent);
            }
        }
    }

    private void appendHistory(Job job, ReportPipeline.Result result) {
        try {
            historyStore.append(job.getUrl(), result.currentPoint());
        } catch (Exception e) {
            log.warn("Failed to append history point for {}: {}", job.key(), e.getMessage());
        }
    }

    private void finish(Job job, JobStatus status, String error) {
        if (!job.getStatus().canTransitionTo(status)) {
            throw new IllegalStateException("Job " + job.getId() + " cannot move from "
                    + job.getStatus().value() + " to " + status.value());
        }
        job.setStatus(status);
        job.setError(error);
        job.setCompletedAt(Instant.now(clock));
        jobRepository.save(job);
    }

    private Job find(String jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private void validate(String url, LocalDate periodStart) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        if (periodStart == null) {
            throw new IllegalArgumentException("periodStart is required");
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("url is not a valid URI: " + url);
        }
        if (uri.getHost() == null || !("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))) {
            throw new IllegalArgumentException("url must be an absolute http(s) URL: " + url);
        }
    }
}
