package com.lulcplatform.common.temporal;

import java.util.Comparator;
import java.util.Locale;
import java.util.Map;

/**
 * Display orderings of the timeline. All are applied as stable sorts over the
 * source-table order, so equal keys keep their source order and re-applying a
 * key always yields the same sequence.
 */
public enum TimelineSortKey {

    /** Lexicographic by initiative name. */
    NAME,

    /** Ascending first available year; initiatives without data last. */
    FIRST_YEAR,

    /** Descending last available year (most recent first); initiatives without data last. */
    LAST_YEAR,

    /** Descending coverage percentage over the global period. */
    COVERAGE;

    Comparator<TimelineRow> comparator(Map<String, InitiativeTemporalStats> stats) {
        return switch (this) {
            case NAME -> Comparator.comparing(TimelineRow::name);
            case FIRST_YEAR -> Comparator.comparing(
                (TimelineRow row) -> stats.get(row.name()).firstYear(),
                Comparator.nullsLast(Comparator.<Integer>naturalOrder()));
            case LAST_YEAR -> Comparator.comparing(
                (TimelineRow row) -> stats.get(row.name()).lastYear(),
                Comparator.nullsLast(Comparator.<Integer>reverseOrder()));
            case COVERAGE -> Comparator.comparingDouble(
                (TimelineRow row) -> stats.get(row.name()).coveragePercentage()).reversed();
        };
    }

    /** Lenient lookup for request parameters; unknown or blank values fall back to {@link #NAME}. */
    public static TimelineSortKey fromParameter(String value) {
        if (value == null || value.isBlank()) return NAME;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (TimelineSortKey key : values()) {
            if (key.name().equals(normalized)) return key;
        }
        return NAME;
    }
}
