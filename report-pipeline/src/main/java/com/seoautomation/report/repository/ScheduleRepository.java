package com.seoautomation.report.repository;

import com.seoautomation.report.model.RecurringSchedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleRepository {

    RecurringSchedule save(RecurringSchedule schedule);

    Optional<RecurringSchedule> findById(String scheduleId);

    /** Schedules whose next run is at or before {@code now}. */
    List<RecurringSchedule> findDue(Instant now);
}
