package com.seoautomation.report.repository;

import com.seoautomation.report.model.HistoricalPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@Slf4j
@ConditionalOnProperty(name = "seo-report.storage.history", havingValue = "memory", matchIfMissing = true)
public class InMemoryHistoryStore implements HistoryStore {

    private final Map<String, List<HistoricalPoint>> history = new ConcurrentHashMap<>();

    @Override
    public List<HistoricalPoint> getHistory(String url, int limit) {
        List<HistoricalPoint> points = history.get(url);
        if (points == null) {
            return List.of();
        }
        synchronized (points) {
            return List.copyOf(points.subList(Math.max(0, points.size() - limit), points.size()));
        }
    }

    @Override
    public List<HistoricalPoint> getHistoryBefore(String url, LocalDate before, int limit) {
        List<HistoricalPoint> points = history.get(url);
        if (points == null) {
            return List.of();
        }
        synchronized (points) {
            int end = 0;
            while (end < points.size() && points.get(end).date().isBefore(before)) {
                end++;
            }
            return List.copyOf(points.subList(Math.max(0, end - limit), end));
        }
    }

    @Override
    public void append(String url, HistoricalPoint point) {
        List<HistoricalPoint> points = history.computeIfAbsent(url, k -> new ArrayList<>());
        synchronized (points) {
            if (points.stream().anyMatch(p -> p.date().equals(point.date()))) {
                log.debug("History point for {} on {} already recorded", url, point.date());
                return;
            }
            points.add(point);
            points.sort(Comparator.comparing(HistoricalPoint::date));
        }
    }
}
