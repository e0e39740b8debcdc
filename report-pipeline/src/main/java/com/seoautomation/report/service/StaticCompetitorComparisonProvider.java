package com.seoautomation.report.service;

import com.seoautomation.report.model.Report;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;

/**
 * Fixed benchmark set used until a competitor data source is wired in. The subject
 * domain is listed alongside with its own score.
 */
@Component
public class StaticCompetitorComparisonProvider implements CompetitorComparisonProvider {

    private static final List<Report.CompetitorSnapshot> BENCHMARKS = List.of(
            new Report.CompetitorSnapshot("Competitor A", 85,
                    List.of("Fast loading", "Mobile optimized"), List.of("Thin content", "Few backlinks")),
            new Report.CompetitorSnapshot("Competitor B", 78,
                    List.of("Strong content", "Good UX"), List.of("Technical issues", "Slow images")));

    @Override
    public List<Report.CompetitorSnapshot> competitorsFor(String url, int overallScore) {
        Report.CompetitorSnapshot own = new Report.CompetitorSnapshot(domainOf(url), overallScore,
                List.of("Solid foundation", "Clean code"), List.of("SEO optimization", "Content depth"));
        return List.of(BENCHMARKS.get(0), BENCHMARKS.get(1), own);
    }

    static String domainOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : url;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }
}
