package com.seoautomation.report.service;

import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.model.Effort;
import com.seoautomation.report.model.Issue;
import com.seoautomation.report.model.IssueSeverity;
import com.seoautomation.report.model.Priority;
import com.seoautomation.report.model.Recommendation;
import com.seoautomation.report.model.ScoreCategory;
import com.seoautomation.report.model.ScoringResult;
import com.seoautomation.report.model.Trend;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives improvement actions from the issue list, category scores and trend.
 */
@Component
@RequiredArgsConstructor
public class ImpactRecommendationAdvisor implements RecommendationAdvisor {

    private final ReportPipelineProperties properties;

    @Override
    public List<Recommendation> advise(ScoringResult scoring, Trend trend) {
        ReportPipelineProperties.Recommendations r = properties.getRecommendations();
        List<Recommendation> recommendations = new ArrayList<>();

        List<Issue> performanceIssues = scoring.getIssues().stream()
                .filter(i -> "performance".equals(i.getType()))
                .toList();
        if (!performanceIssues.isEmpty()) {
            boolean critical = performanceIssues.stream().anyMatch(i -> i.getSeverity() == IssueSeverity.CRITICAL);
            recommendations.add(Recommendation.builder()
                    .id("rec-performance")
                    .category("performance")
                    .priority(critical ? Priority.HIGH : Priority.MEDIUM)
                    .title("Optimize Core Web Vitals")
                    .description(performanceDescription(performanceIssues))
                    .estimatedImpact(15)
                    .estimatedEffort(Effort.MEDIUM)
                    .step("Implement lazy loading for images and videos")
                    .step("Minify and compress JavaScript/CSS")
                    .step("Enable browser caching")
                    .step("Use a CDN for static assets")
                    .build());
        }

        double onPage = scoring.score(ScoreCategory.ON_PAGE);
        if (onPage < r.getOnPageThreshold()) {
            recommendations.add(Recommendation.builder()
                    .id("rec-seo")
                    .category("seo")
                    .priority(onPage < r.getOnPageHighPriorityThreshold() ? Priority.HIGH : Priority.MEDIUM)
                    .title("Improve On-Page SEO")
                    .description("Key SEO elements need optimization to improve search visibility")
                    .estimatedImpact(20)
                    .estimatedEffort(Effort.LOW)
                    .step("Optimize title tags (50-60 characters with primary keyword)")
                    .step("Improve meta descriptions (120-160 characters)")
                    .step("Add structured data markup")
                    .step("Fix broken internal links")
                    .build());
        }

        if (scoring.score(ScoreCategory.CONTENT) < r.getContentThreshold()) {
            recommendations.add(Recommendation.builder()
                    .id("rec-content")
                    .category("content")
                    .priority(Priority.MEDIUM)
                    .title("Enhance Content Quality")
                    .description("Improve content depth and readability for better engagement")
                    .estimatedImpact(12)
                    .estimatedEffort(Effort.HIGH)
                    .step("Increase word count to 1000+ words per page")
                    .step("Improve readability score to Grade 8 or below")
                    .step("Add more supporting media (images, videos, infographics)")
                    .step("Update outdated content")
                    .build());
        }

        if (scoring.score(ScoreCategory.AUTHORITY) < r.getAuthorityThreshold()) {
            recommendations.add(Recommendation.builder()
                    .id("rec-authority")
                    .category("authority")
                    .priority(Priority.MEDIUM)
                    .title("Build Domain Authority")
                    .description("Increase backlinks and social signals to improve authority")
                    .estimatedImpact(18)
                    .estimatedEffort(Effort.HIGH)
                    .step("Create link-worthy content (guides, research, tools)")
                    .step("Guest post on industry websites")
                    .step("Fix broken external links")
                    .step("Monitor and disavow toxic backlinks")
                    .build());
        }

        if (trend.isHasEnoughData() && trend.getVelocity().score() < r.getDecliningVelocity()) {
            recommendations.add(Recommendation.builder()
                    .id("rec-trend")
                    .category("trend")
                    .priority(Priority.HIGH)
                    .title("Investigate Score Decline")
                    .description(String.format("Score is projected to drop %.1f points this month at the current rate",
                            -trend.getVelocity().score()))
                    .estimatedImpact(10)
                    .estimatedEffort(Effort.MEDIUM)
                    .step("Compare this week's issues against the previous report")
                    .step("Check recent deployments for regressions")
                    .step("Re-verify fixes marked as applied")
                    .build());
        }

        return recommendations;
    }

    private String performanceDescription(List<Issue> issues) {
        long critical = issues.stream().filter(i -> i.getSeverity() == IssueSeverity.CRITICAL).count();
        if (critical > 0) {
            return "Address " + critical + " critical performance issues affecting user experience and conversions.";
        }
        long warnings = issues.stream().filter(i -> i.getSeverity() == IssueSeverity.WARNING).count();
        if (warnings > 0) {
            return "Optimize " + warnings + " performance areas to improve page speed scores.";
        }
        return "Maintain current performance levels while monitoring for new issues.";
    }
}
