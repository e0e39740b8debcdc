package com.seoautomation.report.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Registration for automatically generated reports.
 */
@Data
@Builder
public class RecurringSchedule {

    private String id;
    private String url;
    private Cadence cadence;
    private List<String> recipients;
    private Instant createdAt;
    private Instant nextRunAt;
    private String lastJobId;
}
