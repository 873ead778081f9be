package com.lulcplatform.common.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Data-quality report of a crop calendar source.
 * {@code dataCompleteness = 100 - missingDataPercentage}.
 */
public record CalendarValidation(
    @JsonProperty("hasCropCalendar")       boolean hasCropCalendar,
    @JsonProperty("totalCrops")            int totalCrops,
    @JsonProperty("totalStates")           int totalStates,
    @JsonProperty("totalRegions")          int totalRegions,
    @JsonProperty("totalEntries")          int totalEntries,
    @JsonProperty("missingDataPercentage") double missingDataPercentage,
    @JsonProperty("dataCompleteness")      double dataCompleteness,
    @JsonProperty("issues")                List<String> issues
) {

    public CalendarValidation {
        issues = List.copyOf(issues);
    }
}
