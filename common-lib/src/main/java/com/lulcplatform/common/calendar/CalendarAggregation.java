package com.lulcplatform.common.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link CalendarAggregator}.
 *
 * <ul>
 *   <li>{@code intensity}          – planting / harvest / combined tallies (combined codes count twice).</li>
 *   <li>{@code distinct}           – one per entry and month with any activity (combined codes count once).</li>
 *   <li>{@code cropsPerRegion}     – number of distinct crops with at least one activity per region.</li>
 *   <li>{@code monthlyActivities}  – month → activity type → number of entries.</li>
 * </ul>
 * {@code crop} is the crop filter, or null for the national view over all crops.
 */
public record CalendarAggregation(
    @JsonProperty("crop")              String crop,
    @JsonProperty("regions")           List<String> regions,
    @JsonProperty("intensity")         ActivityIntensity intensity,
    @JsonProperty("distinct")          RegionMonthMatrix distinct,
    @JsonProperty("cropsPerRegion")    Map<String, Integer> cropsPerRegion,
    @JsonProperty("monthlyActivities") Map<String, Map<ActivityType, Integer>> monthlyActivities,
    @JsonProperty("notes")             List<String> notes
) {

    public CalendarAggregation {
        regions = List.copyOf(regions);
        cropsPerRegion = Collections.unmodifiableMap(new LinkedHashMap<>(cropsPerRegion));
        Map<String, Map<ActivityType, Integer>> monthly = new LinkedHashMap<>();
        monthlyActivities.forEach((month, counts) -> {
            Map<ActivityType, Integer> copy = new EnumMap<>(ActivityType.class);
            copy.putAll(counts);
            monthly.put(month, Collections.unmodifiableMap(copy));
        });
        monthlyActivities = Collections.unmodifiableMap(monthly);
        notes = List.copyOf(notes);
    }
}
