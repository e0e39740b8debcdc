package com.seoautomation.report.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Recommendation {

    String id;

    String category;

    Priority priority;

    String title;

    String description;

    int estimatedImpact;

    Effort estimatedEffort;

    @Singular
    List<String> steps;
}
