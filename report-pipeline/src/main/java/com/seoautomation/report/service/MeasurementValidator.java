package com.seoautomation.report.service;

import com.seoautomation.report.exception.MeasurementValidationException;
import com.seoautomation.report.model.RawMeasurement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects measurements whose shape is impossible (negative counts, scores out of range).
 * Missing sections are not violations; they are handled by scoring defaults.
 */
@Component
public class MeasurementValidator {

    public void validate(RawMeasurement m) {
        List<String> violations = new ArrayList<>();

        if (m == null) {
            throw new MeasurementValidationException(List.of("measurement is null"));
        }
        if (m.getUrl() == null || m.getUrl().isBlank()) {
            violations.add("url is missing");
        }

        RawMeasurement.Lighthouse lh = m.getLighthouse();
        if (lh != null) {
            unit(violations, "lighthouse.performance", lh.getPerformance());
            unit(violations, "lighthouse.accessibility", lh.getAccessibility());
            unit(violations, "lighthouse.bestPractices", lh.getBestPractices());
            unit(violations, "lighthouse.seo", lh.getSeo());
            unit(violations, "lighthouse.firstContentfulPaintAudit", lh.getFirstContentfulPaintAudit());
            unit(violations, "lighthouse.largestContentfulPaintAudit", lh.getLargestContentfulPaintAudit());
            unit(violations, "lighthouse.mobileFriendlyAudit", lh.getMobileFriendlyAudit());
        }

        RawMeasurement.Html html = m.getHtml();
        if (html != null) {
            nonNegative(violations, "html.h1Count", html.getH1Count());
            nonNegative(violations, "html.h2Count", html.getH2Count());
            nonNegative(violations, "html.h3Count", html.getH3Count());
            nonNegative(violations, "html.imagesTotal", html.getImagesTotal());
            nonNegative(violations, "html.imagesWithAlt", html.getImagesWithAlt());
            nonNegative(violations, "html.internalLinks", html.getInternalLinks());
            nonNegative(violations, "html.externalLinks", html.getExternalLinks());
            nonNegative(violations, "html.wordCount", html.getWordCount());
            nonNegative(violations, "html.readabilityGrade", html.getReadabilityGrade());
            nonNegative(violations, "html.optimizedImages", html.getOptimizedImages());
            nonNegative(violations, "html.checkedImages", html.getCheckedImages());
            if (html.getKeywordDensity() != null
                    && (html.getKeywordDensity() < 0 || html.getKeywordDensity() > 100)) {
                violations.add("html.keywordDensity must be a percentage, was " + html.getKeywordDensity());
            }
            if (exceeds(html.getImagesWithAlt(), html.getImagesTotal())) {
                violations.add("html.imagesWithAlt (" + html.getImagesWithAlt()
                        + ") exceeds html.imagesTotal (" + html.getImagesTotal() + ")");
            }
            if (exceeds(html.getOptimizedImages(), html.getCheckedImages())) {
                violations.add("html.optimizedImages (" + html.getOptimizedImages()
                        + ") exceeds html.checkedImages (" + html.getCheckedImages() + ")");
            }
        }

        RawMeasurement.Performance perf = m.getPerformance();
        if (perf != null) {
            nonNegative(violations, "performance.lcpMs", perf.getLcpMs());
            nonNegative(violations, "performance.fidMs", perf.getFidMs());
            nonNegative(violations, "performance.cls", perf.getCls());
            nonNegative(violations, "performance.fcpMs", perf.getFcpMs());
            nonNegative(violations, "performance.ttfbMs", perf.getTtfbMs());
        }

        RawMeasurement.Backlinks bl = m.getBacklinks();
        if (bl != null) {
            percent(violations, "backlinks.domainAuthority", bl.getDomainAuthority());
            percent(violations, "backlinks.pageAuthority", bl.getPageAuthority());
            nonNegative(violations, "backlinks.backlinks", bl.getBacklinks());
            nonNegative(violations, "backlinks.referringDomains", bl.getReferringDomains());
            nonNegative(violations, "backlinks.spamScore", bl.getSpamScore());
        }

        if (!violations.isEmpty()) {
            throw new MeasurementValidationException(violations);
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void unit(List<String> violations, String field, Double value) {
        if (value != null && (value < 0 || value > 1 || value.isNaN())) {
            violations.add(field + " must be within [0,1], was " + value);
        }
    }

    private void percent(List<String> violations, String field, Double value) {
        if (value != null && (value < 0 || value > 100 || value.isNaN())) {
            violations.add(field + " must be within [0,100], was " + value);
        }
    }

    private void nonNegative(List<String> violations, String field, Number value) {
        if (value != null && value.doubleValue() < 0) {
            violations.add(field + " must not be negative, was " + value);
        }
    }

    private boolean exceeds(Integer part, Integer total) {
        return part != null && total != null && part > total;
    }
}
