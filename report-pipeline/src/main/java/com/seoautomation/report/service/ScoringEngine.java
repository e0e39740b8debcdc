package com.seoautomation.report.service;

import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.model.CategoryScore;
import com.seoautomation.report.model.Issue;
import com.seoautomation.report.model.RawMeasurement;
import com.seoautomation.report.model.ScoreCategory;
import com.seoautomation.report.model.ScoringResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns one raw measurement into five category scores, the weighted overall score
 * and the ranked issue list.
 *
 * Scoring model (all points capped so each category stays within [0,100]):
 *  - On-page: title, description, heading structure, image alt coverage and internal links,
 *    normalised against a 35 point maximum
 *  - Technical: weighted Lighthouse categories plus flat HTTPS / viewport / canonical bonuses
 *  - Content: word count tier, readability grade, keyword density band, media optimisation
 *  - UX: LCP / FID / CLS bands, mobile usability and accessibility
 *  - Authority: domain and page authority, referring domain tiers, inverted spam score
 *
 * A missing provider section never fails scoring: the category falls back to the
 * configured default and the section is listed in {@link ScoringResult#getDefaultedInputs()}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScoringEngine {

    private static final double ON_PAGE_MAX_POINTS = 35;

    private final ReportPipelineProperties properties;
    private final MeasurementValidator validator;
    private final IssueDetector issueDetector;

    public ScoringResult score(RawMeasurement m) {
        validator.validate(m);

        List<String> defaulted = new ArrayList<>();
        if (m.getLighthouse() == null) defaulted.add("lighthouse");
        if (m.getHtml() == null) defaulted.add("html");
        if (m.getPerformance() == null) defaulted.add("performance");
        if (m.getBacklinks() == null) defaulted.add("backlinks");
        if (!defaulted.isEmpty()) {
            log.warn("Measurement for {} is missing {}; applying defaults", m.getUrl(), defaulted);
        }

        Map<ScoreCategory, CategoryScore> scores = new EnumMap<>(ScoreCategory.class);
        scores.put(ScoreCategory.ON_PAGE, scoreOnPage(m.getHtml()));
        scores.put(ScoreCategory.TECHNICAL, scoreTechnical(m));
        scores.put(ScoreCategory.CONTENT, scoreContent(m.getHtml()));
        scores.put(ScoreCategory.UX, scoreUx(m.getLighthouse(), m.getPerformance()));
        scores.put(ScoreCategory.AUTHORITY, scoreAuthority(m.getBacklinks()));

        int overall = overall(scores);
        List<Issue> issues = issueDetector.detect(m);

        log.debug("Scored {}: overall={}, issues={}", m.getUrl(), overall, issues.size());

        return ScoringResult.builder()
                .categoryScores(scores)
                .overallScore(overall)
                .issues(issues)
                .defaultedInputs(List.copyOf(defaulted))
                .measurement(m)
                .build();
    }

    int overall(Map<ScoreCategory, CategoryScore> scores) {
        ReportPipelineProperties.Weights w = properties.getScoring().getWeights();
        double total = scores.get(ScoreCategory.ON_PAGE).getScore() * w.getOnPage()
                + scores.get(ScoreCategory.TECHNICAL).getScore() * w.getTechnical()
                + scores.get(ScoreCategory.CONTENT).getScore() * w.getContent()
                + scores.get(ScoreCategory.UX).getScore() * w.getUx()
                + scores.get(ScoreCategory.AUTHORITY).getScore() * w.getAuthority();
        return (int) Math.max(0, Math.min(100, Math.round(total)));
    }

    // ── On-page ──────────────────────────────────────────────────────────────

    CategoryScore scoreOnPage(RawMeasurement.Html html) {
        if (html == null) {
            return defaulted(ScoreCategory.ON_PAGE, properties.getScoring().getDefaults().getCategoryScore());
        }
        ReportPipelineProperties.Scoring s = properties.getScoring();
        Map<String, Double> raw = new LinkedHashMap<>();

        double title = 0;
        if (hasText(html.getTitle())) {
            title += 5;
            if (inRange(html.getTitle().length(), s.getTitleMinLength(), s.getTitleMaxLength())) title += 5;
        }
        raw.put("title", title);

        double description = 0;
        if (hasText(html.getDescription())) {
            description += 4;
            if (inRange(html.getDescription().length(), s.getDescriptionMinLength(), s.getDescriptionMaxLength())) {
                description += 4;
            }
        }
        raw.put("description", description);

        double headings = 0;
        if (IssueDetector.intOrZero(html.getH1Count()) == 1) headings += 3;
        if (IssueDetector.intOrZero(html.getH2Count()) >= 2) headings += 2;
        if (IssueDetector.intOrZero(html.getH3Count()) >= 3) headings += 2;
        raw.put("headings", headings);

        // No images means nothing lacks alt text
        int images = IssueDetector.intOrZero(html.getImagesTotal());
        double altCoverage = images == 0
                ? 100
                : IssueDetector.intOrZero(html.getImagesWithAlt()) * 100.0 / images;
        raw.put("imageAlt", Math.min(5, altCoverage / 20));

        int internal = IssueDetector.intOrZero(html.getInternalLinks());
        double links = internal >= 10 ? 5 : internal >= 5 ? 3 : internal >= 3 ? 1 : 0;
        raw.put("internalLinks", links);

        Map<String, Double> contributions = new LinkedHashMap<>();
        raw.forEach((k, v) -> contributions.put(k, round1(v * 100 / ON_PAGE_MAX_POINTS)));
        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum() * 100 / ON_PAGE_MAX_POINTS;

        return category(ScoreCategory.ON_PAGE, total, contributions);
    }

    // ── Technical ────────────────────────────────────────────────────────────

    CategoryScore scoreTechnical(RawMeasurement m) {
        ReportPipelineProperties.Scoring s = properties.getScoring();
        ReportPipelineProperties.LighthouseWeights lw = s.getLighthouseWeights();
        double fallback = s.getDefaults().getLighthouseScore();
        RawMeasurement.Lighthouse lh = m.getLighthouse();
        Map<String, Double> contributions = new LinkedHashMap<>();

        contributions.put("performance", lighthouse(lh == null ? null : lh.getPerformance(), fallback) * 100 * lw.getPerformance());
        contributions.put("accessibility", lighthouse(lh == null ? null : lh.getAccessibility(), fallback) * 100 * lw.getAccessibility());
        contributions.put("bestPractices", lighthouse(lh == null ? null : lh.getBestPractices(), fallback) * 100 * lw.getBestPractices());
        contributions.put("seo", lighthouse(lh == null ? null : lh.getSeo(), fallback) * 100 * lw.getSeo());

        RawMeasurement.Html html = m.getHtml();
        contributions.put("https", IssueDetector.usesHttps(m) ? s.getHttpsBonus() : 0);
        contributions.put("responsive", html != null && Boolean.TRUE.equals(html.getResponsive()) ? s.getResponsiveBonus() : 0);
        contributions.put("canonical", html != null && hasText(html.getCanonical()) ? s.getCanonicalBonus() : 0);

        contributions.replaceAll((k, v) -> round1(v));
        double total = contributions.values().stream().mapToDouble(Double::doubleValue).sum();
        return category(ScoreCategory.TECHNICAL, total, contributions);
    }

    // ── Content ──────────────────────────────────────────────────────────────

    CategoryScore scoreContent(RawMeasurement.Html html) {
        if (html == null) {
            return defaulted(ScoreCategory.CONTENT, properties.getScoring().getDefaults().getCategoryScore());
        }
        Map<String, Double> contributions = new LinkedHashMap<>();

        int words = IssueDetector.intOrZero(html.getWordCount());
        double wordPoints = words >= 1500 ? 30 : words >= 1000 ? 25 : words >= 800 ? 20
                : words >= 500 ? 15 : words >= 300 ? 10 : 5;
        contributions.put("wordCount", wordPoints);

        // Unknown readability is scored as the "fairly easy" band
        double grade = html.getReadabilityGrade() == null ? 12 : html.getReadabilityGrade();
        double readability = grade <= 8 ? 30 : grade <= 12 ? 20 : grade <= 16 ? 10 : 5;
        contributions.put("readability", readability);

        double density = html.getKeywordDensity() == null ? 0 : html.getKeywordDensity();
        contributions.put("keywordDensity", round1(Math.min(20, keywordDensityScore(density) / 100 * 20)));

        int checked = IssueDetector.intOrZero(html.getCheckedImages());
        double media = checked == 0
                ? 20
                : Math.min(20, IssueDetector.intOrZero(html.getOptimizedImages()) * 20.0 / checked);
        contributions.put("mediaOptimization", round1(media));

        double total = contributions.values().stream().mapToDouble(Double::doubleValue).sum();
        return category(ScoreCategory.CONTENT, total, contributions);
    }

    /**
     * 100 inside the optimal band, linear falloff below it, 20 points per percent above it.
     */
    double keywordDensityScore(double density) {
        ReportPipelineProperties.Scoring s = properties.getScoring();
        if (density >= s.getKeywordDensityMin() && density <= s.getKeywordDensityMax()) {
            return 100;
        }
        if (density < s.getKeywordDensityMin()) {
            return density / s.getKeywordDensityMin() * 50;
        }
        return Math.max(0, 100 - (density - s.getKeywordDensityMax()) * 20);
    }

    // ── UX ───────────────────────────────────────────────────────────────────

    CategoryScore scoreUx(RawMeasurement.Lighthouse lh, RawMeasurement.Performance perf) {
        ReportPipelineProperties.Scoring s = properties.getScoring();
        Map<String, Double> contributions = new LinkedHashMap<>();

        // Missing timings land in the degraded band rather than full or minimal points
        contributions.put("lcp", perf == null || perf.getLcpMs() == null
                ? 10 : band(perf.getLcpMs(), s.getLcpGoodMs(), s.getLcpPoorMs()));
        contributions.put("fid", perf == null || perf.getFidMs() == null
                ? 10 : band(perf.getFidMs(), s.getFidGoodMs(), s.getFidPoorMs()));
        contributions.put("cls", perf == null || perf.getCls() == null
                ? 10 : band(perf.getCls(), s.getClsGood(), s.getClsPoor()));

        double fallback = s.getDefaults().getLighthouseScore();
        double mobile = lh == null ? fallback : valueOrZero(lh.getMobileFriendlyAudit());
        double accessibility = lh == null ? fallback : valueOrZero(lh.getAccessibility());
        contributions.put("mobileUsability", round1(mobile * 20));
        contributions.put("accessibility", round1(accessibility * 20));

        double total = contributions.values().stream().mapToDouble(Double::doubleValue).sum();
        return category(ScoreCategory.UX, total, contributions);
    }

    private double band(double value, double good, double poor) {
        if (value <= good) return 20;
        if (value <= poor) return 10;
        return 5;
    }

    // ── Authority ────────────────────────────────────────────────────────────

    CategoryScore scoreAuthority(RawMeasurement.Backlinks bl) {
        if (bl == null) {
            return defaulted(ScoreCategory.AUTHORITY, properties.getScoring().getDefaults().getAuthorityScore());
        }
        Map<String, Double> contributions = new LinkedHashMap<>();

        contributions.put("domainAuthority", round1(Math.min(30, valueOrZero(bl.getDomainAuthority()) / 100 * 30)));
        contributions.put("pageAuthority", round1(Math.min(20, valueOrZero(bl.getPageAuthority()) / 100 * 20)));

        int domains = IssueDetector.intOrZero(bl.getReferringDomains());
        double domainPoints = domains >= 1000 ? 30 : domains >= 500 ? 25 : domains >= 250 ? 20
                : domains >= 100 ? 15 : domains >= 50 ? 10 : 5;
        contributions.put("referringDomains", domainPoints);

        double spam = valueOrZero(bl.getSpamScore());
        double spamPoints = spam <= 1 ? 20 : spam <= 3 ? 15 : spam <= 5 ? 10 : 5;
        contributions.put("spamScore", spamPoints);

        double total = contributions.values().stream().mapToDouble(Double::doubleValue).sum();
        return category(ScoreCategory.AUTHORITY, total, contributions);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private CategoryScore category(ScoreCategory category, double total, Map<String, Double> contributions) {
        return CategoryScore.builder()
                .category(category)
                .score(round1(Math.max(0, Math.min(100, total))))
                .contributions(contributions)
                .defaulted(false)
                .build();
    }

    private CategoryScore defaulted(ScoreCategory category, double score) {
        return CategoryScore.builder()
                .category(category)
                .score(score)
                .contributions(Map.of("default", score))
                .defaulted(true)
                .build();
    }

    private double lighthouse(Double value, double fallback) {
        return value == null ? fallback : value;
    }

    private double valueOrZero(Double value) {
        return value == null ? 0 : value;
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private boolean inRange(int value, int min, int max) {
        return value >= min && value <= max;
    }

    static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
