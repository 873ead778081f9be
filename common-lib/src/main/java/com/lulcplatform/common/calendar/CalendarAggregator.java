package com.lulcplatform.common.calendar;

import java.time.Month;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregates sparse crop calendars (crop → state entries → month → code) into
 * dense region × month matrices.
 *
 * <h3>Counting rules</h3>
 * <pre>
 *   code contains P          → planting[region][month] += 1
 *   code contains H          → harvest[region][month]  += 1
 *   code has any activity    → distinct[region][month] += 1
 * </pre>
 * A combined code such as {@code "PH"} or {@code "P/H"} adds 1 to planting, 1 to
 * harvest and 1 (not 2) to distinct. Empty and unknown codes add nothing.
 * Month keys that name no month are skipped with a note.
 *
 * <p>Regions keep first-seen order across the selected crops.
 */
public final class CalendarAggregator {

    private CalendarAggregator() {}

    public static CalendarAggregation aggregate(Map<String, List<CalendarEntry>> cropCalendar) {
        return aggregate(cropCalendar, null);
    }

    /**
     * @param crop restricts the aggregation to one crop; null aggregates all crops
     */
    public static CalendarAggregation aggregate(Map<String, List<CalendarEntry>> cropCalendar, String crop) {
        List<String> notes = new ArrayList<>();
        Map<String, List<CalendarEntry>> selected = new LinkedHashMap<>();
        if (crop == null) {
            selected.putAll(cropCalendar);
        } else if (cropCalendar.containsKey(crop)) {
            selected.put(crop, cropCalendar.get(crop));
        } else {
            notes.add("no calendar for crop '" + crop + "'");
        }

        Set<String> regionSet = new LinkedHashSet<>();
        selected.values().forEach(entries -> entries.forEach(e -> regionSet.add(e.region())));
        List<String> regions = new ArrayList<>(regionSet);

        RegionMonthMatrix.Builder planting = new RegionMonthMatrix.Builder(regions);
        RegionMonthMatrix.Builder harvest = new RegionMonthMatrix.Builder(regions);
        RegionMonthMatrix.Builder distinct = new RegionMonthMatrix.Builder(regions);
        Map<String, Set<String>> cropsByRegion = new LinkedHashMap<>();
        regions.forEach(r -> cropsByRegion.put(r, new HashSet<>()));
        Map<String, Map<ActivityType, Integer>> monthly = emptyMonthlyCounts();

        selected.forEach((cropName, entries) -> {
            for (CalendarEntry entry : entries) {
                entry.calendar().forEach((monthKey, code) -> {
                    Month month = CalendarMonths.parse(monthKey);
                    if (month == null) {
                        notes.add("unknown month '" + monthKey + "' in '" + cropName + "'");
                        return;
                    }
                    ActivityCode activity = ActivityCode.parse(code);
                    if (!activity.hasActivity()) return;

                    if (activity.planting()) planting.increment(entry.region(), month);
                    if (activity.harvest()) harvest.increment(entry.region(), month);
                    distinct.increment(entry.region(), month);
                    cropsByRegion.get(entry.region()).add(cropName);
                    monthly.get(CalendarMonths.label(month)).merge(activity.type(), 1, Integer::sum);
                });
            }
        });

        RegionMonthMatrix plantingMatrix = planting.build();
        RegionMonthMatrix harvestMatrix = harvest.build();
        ActivityIntensity intensity = new ActivityIntensity(
            plantingMatrix, harvestMatrix, plantingMatrix.plus(harvestMatrix));

        Map<String, Integer> cropsPerRegion = new LinkedHashMap<>();
        cropsByRegion.forEach((region, crops) -> cropsPerRegion.put(region, crops.size()));

        return new CalendarAggregation(crop, regions, intensity, distinct.build(),
            cropsPerRegion, monthly, notes);
    }

    private static Map<String, Map<ActivityType, Integer>> emptyMonthlyCounts() {
        Map<String, Map<ActivityType, Integer>> monthly = new LinkedHashMap<>();
        for (String label : CalendarMonths.LABELS) {
            Map<ActivityType, Integer> counts = new EnumMap<>(ActivityType.class);
            counts.put(ActivityType.PLANTING, 0);
            counts.put(ActivityType.HARVEST, 0);
            counts.put(ActivityType.PLANTING_AND_HARVEST, 0);
            monthly.put(label, counts);
        }
        return monthly;
    }
}
