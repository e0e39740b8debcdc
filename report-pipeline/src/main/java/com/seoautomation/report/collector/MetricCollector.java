package com.seoautomation.report.collector;

import com.seoautomation.report.model.RawMeasurement;

/**
 * Source of raw page measurements. Sections the provider cannot supply come back null
 * and are defaulted by the scoring engine.
 */
public interface MetricCollector {

    RawMeasurement fetchMeasurement(String url);
}
