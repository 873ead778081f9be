package com.lulcplatform.common.calendar;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Month keys used by the crop-calendar source: full English names, matched
 * case-insensitively, or their three-letter abbreviations.
 */
public final class CalendarMonths {

    /** January … December, the column order of every region × month matrix. */
    public static final List<String> LABELS = Arrays.stream(Month.values())
        .map(m -> m.getDisplayName(TextStyle.FULL, Locale.ENGLISH))
        .toList();

    private CalendarMonths() {}

    /** @return the month, or {@code null} when the key names no month */
    public static Month parse(String key) {
        if (key == null) return null;
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() < 3) return null;
        for (Month month : Month.values()) {
            String full = month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
            if (full.equals(normalized) || full.substring(0, 3).equals(normalized)) {
                return month;
            }
        }
        return null;
    }

    public static String label(Month month) {
        return LABELS.get(month.ordinal());
    }
}
