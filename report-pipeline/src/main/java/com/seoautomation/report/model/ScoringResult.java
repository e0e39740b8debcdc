package com.seoautomation.report.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Output of one scoring run: five category scores, the weighted overall score and the
 * ranked issue list, plus the measurement they were computed from.
 */
@Value
@Builder
public class ScoringResult {

    Map<ScoreCategory, CategoryScore> categoryScores;

    int overallScore;

    List<Issue> issues;

    /** Measurement sections that were missing and replaced by defaults */
    List<String> defaultedInputs;

    RawMeasurement measurement;

    public double score(ScoreCategory category) {
        CategoryScore cs = categoryScores.get(category);
        return cs == null ? 0 : cs.getScore();
    }

    public long countIssues(IssueSeverity severity) {
        return issues.stream().filter(i -> i.getSeverity() == severity).count();
    }
}
