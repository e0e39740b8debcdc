package com.seoautomation.report.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One category score in [0,100] plus the sub-factor points that produced it.
 */
@Value
@Builder
public class CategoryScore {

    ScoreCategory category;

    double score;

    /** Sub-factor name to points awarded, in evaluation order */
    Map<String, Double> contributions;

    /** True when the category's provider data was missing and the default was applied */
    boolean defaulted;
}
