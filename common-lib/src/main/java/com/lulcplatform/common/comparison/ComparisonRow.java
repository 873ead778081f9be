package com.lulcplatform.common.comparison;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Comparison-matrix row for one initiative.
 *
 * <p>{@code rawValues} and {@code scores} only contain the metrics the initiative
 * reports. {@code overallScore} is the mean of {@code scores}, or {@code null}
 * when the initiative reports none of the tracked metrics.
 */
public record ComparisonRow(
    @JsonProperty("name")         String name,
    @JsonProperty("displayName")  String displayName,
    @JsonProperty("rawValues")    Map<String, Double> rawValues,
    @JsonProperty("scores")       Map<String, Double> scores,
    @JsonProperty("overallScore") Double overallScore
) {

    public ComparisonRow {
        rawValues = Collections.unmodifiableMap(new LinkedHashMap<>(rawValues));
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public boolean hasScore(String column) {
        return scores.containsKey(column);
    }
}
