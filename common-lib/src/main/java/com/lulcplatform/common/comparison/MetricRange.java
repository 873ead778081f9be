package com.lulcplatform.common.comparison;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Observed min/max of a metric across the initiatives that report it.
 */
public record MetricRange(
    @JsonProperty("min")            double min,
    @JsonProperty("max")            double max,
    @JsonProperty("reportingCount") int reportingCount
) {

    /** True when every reporting initiative has the same value. */
    public boolean isDegenerate() {
        return max == min;
    }
}
