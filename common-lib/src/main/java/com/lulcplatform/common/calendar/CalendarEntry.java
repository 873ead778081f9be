package com.lulcplatform.common.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calendar of one crop in one state: month key → activity code. Read-only.
 */
public record CalendarEntry(
    @JsonProperty("region")    String region,
    @JsonProperty("stateCode") String stateCode,
    @JsonProperty("stateName") String stateName,
    @JsonProperty("calendar")  Map<String, String> calendar
) {

    public static final String UNKNOWN_REGION = "Unknown";

    public CalendarEntry {
        region = region == null || region.isBlank() ? UNKNOWN_REGION : region.trim();
        calendar = calendar == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(calendar));
    }
}
