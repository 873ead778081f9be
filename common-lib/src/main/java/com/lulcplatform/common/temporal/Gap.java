package com.lulcplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A maximal run of consecutive missing years strictly inside an initiative's
 * active period. {@code duration = endYear - startYear + 1}, always at least 1.
 */
public record Gap(
    @JsonProperty("startYear") int startYear,
    @JsonProperty("endYear")   int endYear,
    @JsonProperty("duration")  int duration
) {

    public static Gap between(int lastPresentYear, int nextPresentYear) {
        return new Gap(lastPresentYear + 1, nextPresentYear - 1, nextPresentYear - lastPresentYear - 1);
    }

    public boolean contains(int year) {
        return year >= startYear && year <= endYear;
    }
}
