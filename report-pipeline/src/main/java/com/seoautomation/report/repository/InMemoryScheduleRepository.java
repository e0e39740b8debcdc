package com.seoautomation.report.repository;

import com.seoautomation.report.model.RecurringSchedule;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryScheduleRepository implements ScheduleRepository {

    private final Map<String, RecurringSchedule> schedules = new ConcurrentHashMap<>();

    @Override
    public RecurringSchedule save(RecurringSchedule schedule) {
        schedules.put(schedule.getId(), schedule);
        return schedule;
    }

    @Override
    public Optional<RecurringSchedule> findById(String scheduleId) {
        return Optional.ofNullable(schedules.get(scheduleId));
    }

    @Override
    public List<RecurringSchedule> findDue(Instant now) {
        return schedules.values().stream()
                .filter(s -> !s.getNextRunAt().isAfter(now))
                .sorted(Comparator.comparing(RecurringSchedule::getNextRunAt))
                .toList();
    }
}
