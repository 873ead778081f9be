package com.lulcplatform.common.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Intensity tallies: a combined code counts once in {@code planting} and once in
 * {@code harvest}, so {@code total} double-counts it by design of the intensity view.
 * Use {@link CalendarAggregation#distinct()} when distinct activities are needed.
 */
public record ActivityIntensity(
    @JsonProperty("planting") RegionMonthMatrix planting,
    @JsonProperty("harvest")  RegionMonthMatrix harvest,
    @JsonProperty("total")    RegionMonthMatrix total
) {}
