package com.seoautomation.report.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seoautomation.report.config.ReportPipelineProperties;
import com.seoautomation.report.exception.DataUnavailableException;
import com.seoautomation.report.model.RawMeasurement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves measurements from JSON fixtures instead of the provider API. Used for local runs
 * and end-to-end tests.
 *
 * A fixture whose url is {@value #DEFAULT_KEY} acts as the template for urls with no
 * fixture of their own.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "seo-report.collector.mode", havingValue = "fixture")
public class FixtureMetricCollector implements MetricCollector {

    static final String DEFAULT_KEY = "default";

    private final ObjectMapper objectMapper;
    private final Map<String, RawMeasurement> fixtures = new ConcurrentHashMap<>();

    public FixtureMetricCollector(ObjectMapper objectMapper, ReportPipelineProperties properties) {
        this.objectMapper = objectMapper;
        loadFixtures(properties.getCollector().getFixtureLocation());
    }

    public void register(RawMeasurement measurement) {
        fixtures.put(measurement.getUrl(), measurement);
    }

    @Override
    public RawMeasurement fetchMeasurement(String url) {
        RawMeasurement fixture = fixtures.get(url);
        if (fixture == null) {
            fixture = fixtures.get(DEFAULT_KEY);
        }
        if (fixture == null) {
            throw new DataUnavailableException("page", "No fixture registered for " + url);
        }
        // copy so callers never mutate the registered fixture
        RawMeasurement copy = objectMapper.convertValue(fixture, RawMeasurement.class);
        copy.setUrl(url);
        return copy;
    }

    private void loadFixtures(String location) {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(location);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot resolve fixtures at " + location, e);
        }
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                register(objectMapper.readValue(in, RawMeasurement.class));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read fixture " + resource.getFilename(), e);
            }
        }
        log.info("Loaded {} measurement fixtures from {}", fixtures.size(), location);
    }
}
