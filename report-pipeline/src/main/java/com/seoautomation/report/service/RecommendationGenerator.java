package com.seoautomation.report.service;

import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.model.Effort;
import com.seoautomation.report.model.Priority;
import com.seoautomation.report.model.Recommendation;
import com.seoautomation.report.model.ScoreCategory;
import com.seoautomation.report.model.ScoringResult;
import com.seoautomation.report.model.Trend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the ranked, deduplicated recommendation list for a report.
 *
 * Never fails: when the advisor is unavailable or throws, a fixed rule set covering
 * on-page and technical gaps is used instead.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecommendationGenerator {

    static final Comparator<Recommendation> RANKING = Comparator
            .comparing(Recommendation::getPriority)
            .thenComparing(Comparator.comparingInt(Recommendation::getEstimatedImpact).reversed());

    private final RecommendationAdvisor advisor;
    private final ReportPipelineProperties properties;

    public List<Recommendation> generate(ScoringResult scoring, Trend trend) {
        List<Recommendation> candidates = null;
        if (advisor.isAvailable()) {
            try {
                candidates = advisor.advise(scoring, trend);
            } catch (RuntimeException e) {
                log.warn("Recommendation advisor failed, using rule-based fallback: {}", e.getMessage());
            }
        } else {
            log.info("Recommendation advisor unavailable, using rule-based fallback");
        }
        if (candidates == null) {
            candidates = fallback(scoring);
        }
        return rank(candidates);
    }

    /**
     * Sorts by priority then impact, keeps the best entry per category, caps the list.
     */
    List<Recommendation> rank(List<Recommendation> candidates) {
        List<Recommendation> sorted = new ArrayList<>(candidates);
        sorted.sort(RANKING);

        Map<String, Recommendation> byCategory = new LinkedHashMap<>();
        for (Recommendation rec : sorted) {
            byCategory.putIfAbsent(rec.getCategory(), rec);
        }
        return byCategory.values().stream()
                .limit(properties.getRecommendations().getMaxRecommendations())
                .toList();
    }

    List<Recommendation> fallback(ScoringResult scoring) {
        ReportPipelineProperties.Recommendations r = properties.getRecommendations();
        List<Recommendation> recommendations = new ArrayList<>();

        if (scoring.score(ScoreCategory.ON_PAGE) < r.getOnPageThreshold()) {
            recommendations.add(Recommendation.builder()
                    .id("rec-seo")
                    .category("seo")
                    .priority(Priority.MEDIUM)
                    .title("Basic SEO Optimization Needed")
                    .description("Improve basic on-page SEO factors")
                    .estimatedImpact(15)
                    .estimatedEffort(Effort.LOW)
                    .build());
        }

        if (scoring.score(ScoreCategory.TECHNICAL) < r.getTechnicalThreshold()) {
            recommendations.add(Recommendation.builder()
                    .id("rec-technical")
                    .category("technical")
                    .priority(Priority.HIGH)
                    .title("Technical Issues Detected")
                    .description("Fix critical technical SEO issues")
                    .estimatedImpact(25)
                    .estimatedEffort(Effort.MEDIUM)
                    .build());
        }

        return recommendations;
    }
}
