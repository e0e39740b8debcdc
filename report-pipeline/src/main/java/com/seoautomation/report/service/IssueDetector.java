package com.seoautomation.report.service;

import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.model.Issue;
import com.seoautomation.report.model.IssueSeverity;
import com.seoautomation.report.model.RawMeasurement;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scans a measurement for known failure patterns and emits one issue per match,
 * each with a fixed severity and impact. Result is ranked: severity first, then impact.
 */
@Component
@RequiredArgsConstructor
public class IssueDetector {

    static final Comparator<Issue> RANKING = Comparator
            .comparing(Issue::getSeverity)
            .thenComparing(Comparator.comparingInt(Issue::getImpact).reversed());

    private final ReportPipelineProperties properties;

    public List<Issue> detect(RawMeasurement m) {
        List<Issue> issues = new ArrayList<>();
        double passThreshold = properties.getScoring().getAuditPassThreshold();

        RawMeasurement.Lighthouse lh = m.getLighthouse();
        if (lh != null) {
            if (lh.getFirstContentfulPaintAudit() != null && lh.getFirstContentfulPaintAudit() < passThreshold) {
                issues.add(issue("performance", IssueSeverity.CRITICAL,
                        "Slow First Contentful Paint",
                        "Optimize server response time, reduce render-blocking resources", 15));
            }
            if (lh.getLargestContentfulPaintAudit() != null && lh.getLargestContentfulPaintAudit() < passThreshold) {
                issues.add(issue("performance", IssueSeverity.WARNING,
                        "Large images or videos delaying LCP",
                        "Optimize images, use next-gen formats, implement lazy loading", 10));
            }
        }

        RawMeasurement.Html html = m.getHtml();
        if (html != null) {
            if (html.getTitle() == null || html.getTitle().isBlank()) {
                issues.add(issue("seo", IssueSeverity.CRITICAL,
                        "Missing page title",
                        "Add a unique, descriptive title tag (50-60 characters)", 20));
            }

            int h1 = intOrZero(html.getH1Count());
            if (h1 != 1) {
                issues.add(issue("seo", IssueSeverity.WARNING,
                        h1 == 0 ? "Missing H1 tag" : "Multiple H1 tags",
                        "Ensure exactly one H1 tag per page with primary keyword", 15));
            }

            int withoutAlt = intOrZero(html.getImagesTotal()) - intOrZero(html.getImagesWithAlt());
            if (withoutAlt > 0) {
                issues.add(issue("accessibility", IssueSeverity.WARNING,
                        withoutAlt + " images missing alt text",
                        "Add descriptive alt text to all images", 8));
            }
        }

        if (!usesHttps(m)) {
            issues.add(issue("security", IssueSeverity.CRITICAL,
                    "Site not using HTTPS",
                    "Install SSL certificate and redirect all HTTP traffic to HTTPS", 25));
        }

        issues.sort(RANKING);
        return List.copyOf(issues);
    }

    /**
     * HTTPS as reported by the HTML provider, otherwise inferred from the URL scheme.
     */
    static boolean usesHttps(RawMeasurement m) {
        if (m.getHtml() != null && m.getHtml().getSsl() != null) {
            return m.getHtml().getSsl();
        }
        return m.getUrl() != null && m.getUrl().startsWith("https://");
    }

    static int intOrZero(Integer value) {
        return value == null ? 0 : value;
    }

    private Issue issue(String type, IssueSeverity severity, String message, String remediation, int impact) {
        return Issue.builder()
                .type(type)
                .severity(severity)
                .message(message)
                .remediation(remediation)
                .impact(impact)
                .build();
    }
}
