package com.seoautomation.report.config;

import com.seoautomation.report.exception.JobNotFoundException;
import com.seoautomation.report.exception.ReportNotFoundException;
import com.seoautomation.report.exception.SchedulerOverloadException;
import com.seoautomation.report.exception.UnsupportedExportFormatException;
import com.seoautomation.report.model.Cadence;
import com.seoautomation.report.model.JobStatusSnapshot;
import com.seoautomation.report.model.Report;
import com.seoautomation.report.model.ReportPeriod;
import com.seoautomation.report.model.SubmitResult;
import com.seoautomation.report.output.ExportedReport;
import com.seoautomation.report.service.ReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/reports")
@Slf4j
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;
    private final Clock clock;

    public record SubmitRequest(String url, LocalDate periodStart) {}

    public record ScheduleRequest(String url, String cadence, List<String> recipients) {}

    // ── Report jobs ───────────────────────────────────────────────────────────

    /**
     * Submit a report for generation.
     *
     * POST /reports {"url": "https://example.com", "periodStart": "2024-03-04"}
     *
     * Without periodStart the current week (Monday start) is used. Returns the existing
     * report when one was already generated for that week.
     */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody SubmitRequest request) {
        try {
            LocalDate periodStart = request.periodStart() != null
                    ? request.periodStart()
                    : ReportPeriod.weekContaining(LocalDate.now(clock)).start();

            SubmitResult result = reportService.submitReport(request.url(), periodStart);
            if (result.isCacheHit()) {
                return ResponseEntity.ok(result.existingReport());
            }

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("jobId", result.jobId());
            body.put("estimatedSeconds", result.estimatedSeconds());
            body.put("deduplicated", result.deduplicated());
            return ResponseEntity.accepted().body(body);

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (SchedulerOverloadException e) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                    .body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Report submit failed for {}: {}", request.url(), e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> jobStatus(@PathVariable String jobId) {
        try {
            JobStatusSnapshot snapshot = reportService.getJobStatus(jobId);
            return ResponseEntity.ok(snapshot);
        } catch (JobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<?> cancel(@PathVariable String jobId) {
        try {
            boolean cancelled = reportService.cancelJob(jobId);
            return ResponseEntity.ok(Map.of("jobId", jobId, "cancelled", cancelled));
        } catch (JobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Cancel failed for job {}: {}", jobId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    // ── Reports ───────────────────────────────────────────────────────────────

    @GetMapping("/{reportId}")
    public ResponseEntity<?> getReport(@PathVariable String reportId) {
        try {
            Report report = reportService.getReport(reportId);
            return ResponseEntity.ok(report);
        } catch (ReportNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Download a report.
     *
     * GET /reports/{reportId}/export?format=tabular-csv
     */
    @GetMapping("/{reportId}/export")
    public ResponseEntity<?> export(
            @PathVariable String reportId,
            @RequestParam(defaultValue = "structured-json") String format) {
        try {
            ExportedReport exported = reportService.exportReport(reportId, format);
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(exported.contentType()))
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            ContentDisposition.attachment().filename(exported.fileName()).build().toString())
                    .body(exported.content());
        } catch (UnsupportedExportFormatException e) {
            return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("error", e.getMessage()));
        } catch (ReportNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Export failed for report {} as {}: {}", reportId, format, e.getMessage(), e);
            return ResponseEntity.internalServerError().contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("error", e.getMessage()));
        }
    }

    // ── Schedules ─────────────────────────────────────────────────────────────

    @PostMapping("/schedules")
    public ResponseEntity<?> schedule(@RequestBody ScheduleRequest request) {
        try {
            if (request.url() == null || request.url().isBlank()) {
                return ResponseEntity.badRequest().body(Map.of("error", "url is required"));
            }
            String scheduleId = reportService.scheduleRecurring(request.url(), Cadence.fromValue(request.cadence()),
                    request.recipients());
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("scheduleId", scheduleId));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
