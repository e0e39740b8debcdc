package com.seoautomation.report.model;

import lombok.Builder;
import lombok.Value;

/**
 * Derived trend over the score history. Recomputed on every run and only ever
 * persisted as part of the report that contains it.
 */
@Value
@Builder
public class Trend {

    boolean hasEnoughData;

    WeeklyChange weeklyChange;

    /** Least-squares slope of the most recent scores against their index */
    double monthlySlope;

    TrendDirection scoreDirection;

    TrendDirection issueDirection;

    TrendDirection fixDirection;

    Velocity velocity;

    double confidence;

    public static Trend insufficient() {
        return Trend.builder()
                .hasEnoughData(false)
                .weeklyChange(new WeeklyChange(0, 0, 0, 0))
                .monthlySlope(0)
                .scoreDirection(TrendDirection.STABLE)
                .issueDirection(TrendDirection.STABLE)
                .fixDirection(TrendDirection.STABLE)
                .velocity(new Velocity(0, 0))
                .confidence(0)
                .build();
    }

    public record WeeklyChange(double score, int issues, int fixes, long traffic) {}

    /** Naive monthly projection of the score and the change in weekly change, halved. */
    public record Velocity(double score, double acceleration) {}
}
