package com.seoautomation.report.service;

import com.seoautomation.report.exception.ReportNotFoundException;
import com.seoautomation.report.model.Cadence;
import com.seoautomation.report.model.JobStatusSnapshot;
import com.seoautomation.report.model.RecurringSchedule;
import com.seoautomation.report.model.Report;
import com.seoautomation.report.model.SubmitResult;
import com.seoautomation.report.output.ExportFormat;
import com.seoautomation.report.output.ExportRouter;
import com.seoautomation.report.output.ExportedReport;
import com.seoautomation.report.repository.ReportRepository;
import com.seoautomation.report.scheduler.RecurringReportScheduler;
import com.seoautomation.report.scheduler.ReportJobScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Entry point for callers: submit, poll, fetch, export and schedule reports.
 */
@Service
@RequiredArgsConstructor
public class ReportService {

    private final ReportJobScheduler jobScheduler;
    private final RecurringReportScheduler recurringScheduler;
    private final ReportRepository reportRepository;
    private final ExportRouter exportRouter;

    public SubmitResult submitReport(String url, LocalDate periodStart) {
        return jobScheduler.submit(url, periodStart);
    }

    public JobStatusSnapshot getJobStatus(String jobId) {
        return jobScheduler.status(jobId);
    }

    public boolean cancelJob(String jobId) {
        return jobScheduler.cancel(jobId);
    }

    public Report getReport(String reportId) {
        return reportRepository.findById(reportId).orElseThrow(() -> new ReportNotFoundException(reportId));
    }

    /**
     * The format is checked before the report is looked up.
     */
    public ExportedReport exportReport(String reportId, String format) {
        ExportFormat exportFormat = ExportFormat.fromValue(format);
        return exportRouter.export(getReport(reportId), exportFormat);
    }

    public String scheduleRecurring(String url, Cadence cadence, List<String> recipients) {
        RecurringSchedule schedule = recurringScheduler.register(url, cadence, recipients);
        return schedule.getId();
    }
}
