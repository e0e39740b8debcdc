package com.seoautomation.report.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Forecast {

    int predictedScore;

    double confidence;

    String timeframe;

    double bestCase;

    double worstCase;

    /** False when the history was too short and the current score was carried forward */
    boolean basedOnHistory;

    @Singular
    List<String> keyDrivers;

    @Singular
    List<String> notes;
}
