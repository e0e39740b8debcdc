package com.seoautomation.report.service;

import com.seoautomation.report.model.Recommendation;
import com.seoautomation.report.model.ScoringResult;
import com.seoautomation.report.model.Trend;

import java.util.List;

/**
 * Primary source of recommendations. Implementations may depend on remote services and
 * are allowed to fail; {@link RecommendationGenerator} falls back to fixed rules.
 */
public interface RecommendationAdvisor {

    List<Recommendation> advise(ScoringResult scoring, Trend trend);

    default boolean isAvailable() {
        return true;
    }
}
