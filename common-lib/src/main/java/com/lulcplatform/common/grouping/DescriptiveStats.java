package com.lulcplatform.common.grouping;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Mean, population standard deviation, min and max of a set of values.
 * All four are null when the set is empty.
 */
public record DescriptiveStats(
    @JsonProperty("count") int    count,
    @JsonProperty("mean")  Double mean,
    @JsonProperty("std")   Double std,
    @JsonProperty("min")   Double min,
    @JsonProperty("max")   Double max
) {

    public static DescriptiveStats of(Collection<Double> values) {
        double[] present = values.stream()
            .filter(v -> v != null)
            .mapToDouble(Double::doubleValue)
            .toArray();
        if (present.length == 0) {
            return new DescriptiveStats(0, null, null, null, null);
        }

        double sum = 0, min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double v : present) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / present.length;

        // Population variance (divide by n)
        double squared = 0;
        for (double v : present) {
            squared += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(squared / present.length);

        return new DescriptiveStats(present.length, mean, std, min, max);
    }
}
