package com.seoautomation.report.collector;

import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.exception.DataUnavailableException;
import com.seoautomation.report.model.RawMeasurement;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Client for the measurement provider REST API.
 *
 * Page data (lighthouse, html, timings) and backlink data come from separate endpoints.
 * A 404 on either is treated as "no data" and the section is left null. Transport
 * errors and 5xx responses trigger the Resilience4j retry.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "seo-report.collector.mode", havingValue = "http", matchIfMissing = true)
public class HttpMetricCollector implements MetricCollector {

    private final RestTemplate restTemplate;
    private final ReportPipelineProperties properties;

    @Override
    @Retry(name = "metricCollector")
    public RawMeasurement fetchMeasurement(String url) {
        RawMeasurement measurement;
        try {
            measurement = fetchSection("page", "/measurements/page", url, RawMeasurement.class);
        } catch (DataUnavailableException e) {
            log.warn("No page measurement for {}, all page sections will be defaulted", url);
            measurement = new RawMeasurement();
        }
        measurement.setUrl(url);
        measurement.setBacklinks(fetchBacklinks(url));
        return measurement;
    }

    /**
     * Backlink data is optional; any failure here downgrades to the authority default.
     */
    RawMeasurement.Backlinks fetchBacklinks(String url) {
        try {
            return fetchSection("backlinks", "/measurements/backlinks", url, RawMeasurement.Backlinks.class);
        } catch (DataUnavailableException | RestClientException e) {
            log.warn("Backlink data unavailable for {}: {}", url, e.getMessage());
            return null;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> T fetchSection(String section, String path, String url, Class<T> type) {
        String endpoint = UriComponentsBuilder
                .fromHttpUrl(properties.getCollector().getBaseUrl() + path)
                .queryParam("url", url)
                .toUriString();

        log.debug("Calling measurement API: {}", endpoint);
        try {
            T response = restTemplate.getForObject(endpoint, type);
            if (response == null) {
                throw new DataUnavailableException(section, "Empty response from " + path);
            }
            return response;

        } catch (HttpClientErrorException.NotFound e) {
            throw new DataUnavailableException(section, "No " + section + " data (404) for " + url);

        } catch (RestClientException e) {
            log.error("Measurement API call failed for {}: {}", endpoint, e.getMessage());
            throw e;
        }
    }
}
