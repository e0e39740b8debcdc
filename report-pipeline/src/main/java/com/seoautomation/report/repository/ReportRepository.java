package com.seoautomation.report.repository;

import com.seoautomation.report.model.Report;
import com.seoautomation.report.model.ReportKey;

import java.util.Optional;

public interface ReportRepository {

    /** Stores a finished report. A report already stored under the same key is kept. */
    Report save(Report report);

    Optional<Report> findById(String reportId);

    Optional<Report> findByKey(ReportKey key);
}
