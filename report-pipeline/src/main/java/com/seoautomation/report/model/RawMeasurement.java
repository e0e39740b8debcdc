package com.seoautomation.report.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw per-URL measurements as returned by a metric collector.
 * Kept separate from the scoring model to isolate provider coupling.
 *
 * Any section may be null when its provider timed out or returned nothing;
 * the scoring engine substitutes documented defaults for missing sections.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawMeasurement {

    private String url;

    private Lighthouse lighthouse;

    private Html html;

    private Performance performance;

    private Backlinks backlinks;

    /** Lighthouse category scores and selected audits, all in [0,1]. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Lighthouse {
        private Double performance;
        private Double accessibility;
        private Double bestPractices;
        private Double seo;
        private Double firstContentfulPaintAudit;
        private Double largestContentfulPaintAudit;
        private Double mobileFriendlyAudit;
    }

    /** Facts extracted from the page markup. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Html {
        private String title;
        private String description;
        private String canonical;
        private Boolean ssl;
        private Boolean responsive;
        private Boolean html5;
        private Boolean schemaMarkup;
        private Integer h1Count;
        private Integer h2Count;
        private Integer h3Count;
        private Integer imagesTotal;
        private Integer imagesWithAlt;
        private Integer internalLinks;
        private Integer externalLinks;
        private Integer wordCount;
        /** Flesch-Kincaid grade level, 1..20 */
        private Double readabilityGrade;
        /** Main keyword density in percent */
        private Double keywordDensity;
        private Integer optimizedImages;
        private Integer checkedImages;
    }

    /** Navigation and Core Web Vitals timings. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Performance {
        private Double lcpMs;
        private Double fidMs;
        private Double cls;
        private Double fcpMs;
        private Double ttfbMs;
        private Double domInteractiveMs;
        private Double loadEventMs;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Backlinks {
        private Double domainAuthority;
        private Double pageAuthority;
        private Long backlinks;
        private Integer referringDomains;
        private Double spamScore;
    }
}
