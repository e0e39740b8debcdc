package com.seoautomation.report.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Job lifecycle: pending → processing → {completed, failed, cancelled}.
 * Pending jobs may also be cancelled directly. Terminal states never change.
 */
public enum JobStatus {

    PENDING(0),
    PROCESSING(1),
    COMPLETED(2),
    FAILED(2),
    CANCELLED(2);

    private final int rank;

    JobStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 2;
    }

    public boolean isActive() {
        return !isTerminal();
    }

    public boolean canTransitionTo(JobStatus next) {
        return !isTerminal() && next.rank > rank;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
