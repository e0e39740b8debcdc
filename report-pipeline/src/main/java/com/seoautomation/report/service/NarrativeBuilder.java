package com.seoautomation.report.service;

import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.model.Effort;
import com.seoautomation.report.model.Forecast;
import com.seoautomation.report.model.IssueSeverity;
import com.seoautomation.report.model.RawMeasurement;
import com.seoautomation.report.model.Recommendation;
import com.seoautomation.report.model.Report;
import com.seoautomation.report.model.ScoreCategory;
import com.seoautomation.report.model.ScoringResult;
import com.seoautomation.report.model.Trend;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns scores, trend and forecast into the strengths / weaknesses / opportunities /
 * threats lists and a short set of actionable insights. Every list has a default entry
 * so the narrative is never empty.
 */
@Component
@RequiredArgsConstructor
public class NarrativeBuilder {

    private final ReportPipelineProperties properties;

    public Report.Swot swot(ScoringResult scoring, Trend trend) {
        return new Report.Swot(strengths(scoring), weaknesses(scoring), opportunities(scoring, trend),
                threats(scoring, trend));
    }

    List<String> strengths(ScoringResult s) {
        List<String> out = new ArrayList<>();
        if (s.score(ScoreCategory.ON_PAGE) >= 80) out.add("Strong on-page SEO foundation");
        if (s.score(ScoreCategory.TECHNICAL) >= 85) out.add("Excellent technical performance");
        if (s.score(ScoreCategory.CONTENT) >= 75) out.add("High-quality content");
        if (s.score(ScoreCategory.UX) >= 80) out.add("Great user experience");
        if (s.score(ScoreCategory.AUTHORITY) >= 70) out.add("Good domain authority");
        return out.isEmpty() ? List.of("Solid baseline performance") : out;
    }

    List<String> weaknesses(ScoringResult s) {
        List<String> out = new ArrayList<>();
        if (s.score(ScoreCategory.ON_PAGE) < 60) out.add("On-page SEO needs improvement");
        if (s.score(ScoreCategory.TECHNICAL) < 60) out.add("Technical issues affecting performance");
        if (s.score(ScoreCategory.CONTENT) < 60) out.add("Content quality below standards");
        if (s.score(ScoreCategory.UX) < 60) out.add("User experience needs optimization");
        long critical = s.countIssues(IssueSeverity.CRITICAL);
        if (critical > 0) out.add(critical + " critical issues found");
        return out.isEmpty() ? List.of("No major weaknesses detected") : out;
    }

    List<String> opportunities(ScoringResult s, Trend trend) {
        List<String> out = new ArrayList<>();
        double onPage = s.score(ScoreCategory.ON_PAGE);
        double content = s.score(ScoreCategory.CONTENT);
        if (onPage >= 60 && onPage < 75) out.add("Quick wins available in on-page optimization");
        if (content >= 65 && content < 80) out.add("Content enhancement could drive significant gains");
        if (trend.getVelocity().score() > 5) out.add("Strong positive momentum - capitalize on current trajectory");

        RawMeasurement.Lighthouse lh = s.getMeasurement() == null ? null : s.getMeasurement().getLighthouse();
        if (lh != null && lh.getSeo() != null && lh.getSeo() < 0.9) {
            out.add("SEO audit reveals multiple optimization opportunities");
        }
        return out.isEmpty() ? List.of("Incremental improvements across all areas") : out;
    }

    List<String> threats(ScoringResult s, Trend trend) {
        List<String> out = new ArrayList<>();
        if (trend.getVelocity().score() < -3) out.add("Negative trend detected - immediate action required");
        long critical = s.countIssues(IssueSeverity.CRITICAL);
        if (critical >= 3) out.add("Multiple critical issues could impact rankings");
        if (s.score(ScoreCategory.TECHNICAL) < 50) out.add("Technical debt accumulating - may affect crawlability");
        if (s.getMeasurement() != null && !IssueDetector.usesHttps(s.getMeasurement())) {
            out.add("Missing HTTPS - security and ranking risk");
        }
        return out.isEmpty() ? List.of("Standard competitive pressures") : out;
    }

    public List<String> insights(ScoringResult s, List<Recommendation> recommendations, Forecast forecast) {
        List<String> out = new ArrayList<>();

        long quickWins = recommendations.stream()
                .filter(r -> r.getEstimatedEffort() == Effort.LOW && r.getEstimatedImpact() >= 10)
                .count();
        if (quickWins > 0) out.add(quickWins + " quick wins identified with significant impact");

        long critical = s.countIssues(IssueSeverity.CRITICAL);
        if (critical > 0) out.add(critical + " critical issues need immediate attention");

        int current = s.getOverallScore();
        if (forecast.getConfidence() > 0.7) {
            if (forecast.getPredictedScore() > current * 1.1) {
                out.add("Strong growth potential with recommended improvements");
            } else if (forecast.getPredictedScore() < current * 0.9) {
                out.add("Risk of decline without immediate action");
            }
        }

        int totalImpact = recommendations.stream().mapToInt(Recommendation::getEstimatedImpact).sum();
        if (totalImpact > 30) out.add("Potential " + totalImpact + "% improvement from implementing recommendations");

        return out.stream().limit(properties.getReport().getMaxInsights()).toList();
    }
}
