package com.lulcplatform.analytics.loader;

import com.lulcplatform.common.calendar.CropCalendar;
import com.lulcplatform.common.model.Initiative;
import com.lulcplatform.common.model.InitiativeMetadata;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything read from disk for one session.
 * {@code rawCropCalendar} is null when no calendar is configured or the file has
 * no {@code crop_calendar} section.
 */
public record LoadedSources(
    List<Initiative> initiatives,
    Map<String, InitiativeMetadata> metadata,
    Map<String, Object> rawCropCalendar,
    CropCalendar cropCalendar,
    Instant loadedAt
) {

    public LoadedSources {
        initiatives = List.copyOf(initiatives);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
