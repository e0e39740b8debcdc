package com.seoautomation.report.repository;

import com.seoautomation.report.model.Report;
import com.seoautomation.report.model.ReportKey;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryReportRepository implements ReportRepository {

    private final Map<String, Report> byId = new ConcurrentHashMap<>();
    private final Map<ReportKey, Report> byKey = new ConcurrentHashMap<>();

    @Override
    public Report save(Report report) {
        Report stored = byKey.putIfAbsent(report.key(), report);
        if (stored != null) {
            return stored;
        }
        byId.put(report.getId(), report);
        return report;
    }

    @Override
    public Optional<Report> findById(String reportId) {
        return Optional.ofNullable(byId.get(reportId));
    }

    @Override
    public Optional<Report> findByKey(ReportKey key) {
        return Optional.ofNullable(byKey.get(key));
    }
}
