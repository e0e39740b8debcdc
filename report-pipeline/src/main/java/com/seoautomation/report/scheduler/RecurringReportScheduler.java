package com.seoautomation.report.scheduler;

import com.seoautomation.report.exception.SchedulerOverloadException;
import com.seoautomation.report.model.Cadence;
import com.seoautomation.report.model.RecurringSchedule;
import com.seoautomation.report.model.ReportPeriod;
import com.seoautomation.report.model.SubmitResult;
import com.seoautomation.report.repository.ScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Submits reports for registered schedules when they fall due. Each run reports on the
 * week containing the run date; delivery to recipients is handled downstream.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RecurringReportScheduler {

    private final ReportJobScheduler jobScheduler;
    private final ScheduleRepository scheduleRepository;
    private final Clock clock;

    public RecurringSchedule register(String url, Cadence cadence, List<String> recipients) {
        if (cadence == null) {
            throw new IllegalArgumentException("cadence is required");
        }
        List<String> to = recipients == null ? List.of() : List.copyOf(recipients);
        to.stream()
                .filter(r -> r == null || !r.contains("@"))
                .findFirst()
                .ifPresent(r -> {
                    throw new IllegalArgumentException("Invalid recipient address: " + r);
                });

        Instant now = Instant.now(clock);
        RecurringSchedule schedule = RecurringSchedule.builder()
                .id(UUID.randomUUID().toString())
                .url(url)
                .cadence(cadence)
                .recipients(to)
                .createdAt(now)
                .nextRunAt(now)
                .build();
        scheduleRepository.save(schedule);
        log.info("Registered {} schedule {} for {} ({} recipients)", cadence.value(), schedule.getId(), url, to.size());
        return schedule;
    }

    @Scheduled(fixedDelayString = "${seo-report.scheduler.recurring-check-interval-ms:60000}")
    public void runDueSchedules() {
        Instant now = Instant.now(clock);
        for (RecurringSchedule schedule : scheduleRepository.findDue(now)) {
            LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
            try {
                SubmitResult result = jobScheduler.submit(schedule.getUrl(), ReportPeriod.weekContaining(today).start());
                if (result.isCacheHit()) {
                    log.info("Schedule {}: report {} already exists", schedule.getId(), result.existingReport().getId());
                } else {
                    schedule.setLastJobId(result.jobId());
                    log.info("Schedule {}: submitted job {} for {}, delivering to {}",
                            schedule.getId(), result.jobId(), schedule.getUrl(), schedule.getRecipients());
                }
            } catch (SchedulerOverloadException e) {
                log.warn("Schedule {} deferred, scheduler overloaded: {}", schedule.getId(), e.getMessage());
                continue;
            } catch (Exception e) {
                log.error("Schedule {} failed to submit: {}", schedule.getId(), e.getMessage(), e);
            }
            schedule.setNextRunAt(nextRun(schedule.getCadence(), schedule.getNextRunAt(), now));
            scheduleRepository.save(schedule);
        }
    }

    /** First cadence step after {@code now}, skipping any missed runs. */
    static Instant nextRun(Cadence cadence, Instant from, Instant now) {
        Instant next = cadence.next(from);
        while (!next.isAfter(now)) {
            next = cadence.next(next);
        }
        return next;
    }
}
