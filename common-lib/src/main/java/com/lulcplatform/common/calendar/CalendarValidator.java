package com.lulcplatform.common.calendar;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the quality of a raw {@code crop_calendar} structure before it is
 * aggregated. Problems are collected as issues, never thrown.
 */
public final class CalendarValidator {

    private CalendarValidator() {}

    /**
     * @param rawCropCalendar the untyped crop → entries structure; null means the
     *                        source has no calendar section at all
     */
    public static CalendarValidation validate(Map<String, ?> rawCropCalendar) {
        List<String> issues = new ArrayList<>();
        if (rawCropCalendar == null) {
            issues.add("crop_calendar section not found");
            return new CalendarValidation(false, 0, 0, 0, 0, 0.0, 0.0, issues);
        }

        CropCalendar calendar = CropCalendar.fromRaw(rawCropCalendar);
        issues.addAll(calendar.notes());

        Set<String> states = new HashSet<>();
        Set<String> regions = new HashSet<>();
        int totalEntries = 0;
        int missingEntries = 0;
        for (List<CalendarEntry> entries : calendar.crops().values()) {
            for (CalendarEntry entry : entries) {
                states.add(entry.stateCode() == null ? "N/A" : entry.stateCode());
                regions.add(entry.region());
                for (String code : entry.calendar().values()) {
                    totalEntries++;
                    if (code == null || code.isBlank()) missingEntries++;
                }
            }
        }

        double missing = totalEntries == 0 ? 0.0 : (double) missingEntries / totalEntries * 100.0;
        double completeness = totalEntries == 0 ? 0.0 : 100.0 - missing;
        return new CalendarValidation(true, calendar.crops().size(), states.size(), regions.size(),
            totalEntries, missing, completeness, issues);
    }
}
