package com.lulcplatform.common.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed crop calendar: crop → per-state entries, in source order, plus notes
 * about source payloads that could not be used.
 */
public record CropCalendar(
    @JsonProperty("crops") Map<String, List<CalendarEntry>> crops,
    @JsonProperty("notes") List<String> notes
) {

    public CropCalendar {
        Map<String, List<CalendarEntry>> copy = new LinkedHashMap<>();
        crops.forEach((crop, entries) -> copy.put(crop, List.copyOf(entries)));
        crops = Collections.unmodifiableMap(copy);
        notes = List.copyOf(notes);
    }

    /**
     * Reads the loosely typed {@code crop_calendar} structure. Crop payloads that
     * are not lists, and list items that are not objects, are skipped with a note.
     */
    public static CropCalendar fromRaw(Map<String, ?> raw) {
        Map<String, List<CalendarEntry>> crops = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();
        if (raw == null) {
            return new CropCalendar(crops, notes);
        }

        raw.forEach((crop, payload) -> {
            if (!(payload instanceof List<?> items)) {
                notes.add("calendar for '" + crop + "' is not a list");
                return;
            }
            List<CalendarEntry> entries = new ArrayList<>();
            for (Object item : items) {
                if (item instanceof Map<?, ?> record) {
                    entries.add(toEntry(record));
                } else {
                    notes.add("invalid calendar entry in '" + crop + "'");
                }
            }
            crops.put(crop, entries);
        });
        return new CropCalendar(crops, notes);
    }

    private static CalendarEntry toEntry(Map<?, ?> record) {
        Map<String, String> calendar = new LinkedHashMap<>();
        if (record.get("calendar") instanceof Map<?, ?> months) {
            months.forEach((month, code) ->
                calendar.put(String.valueOf(month), code == null ? "" : code.toString()));
        }
        return new CalendarEntry(
            text(record.get("region")),
            text(record.get("state_code")),
            text(record.get("state_name")),
            calendar);
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
