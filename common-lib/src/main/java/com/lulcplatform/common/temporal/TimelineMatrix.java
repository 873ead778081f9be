package com.lulcplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dense initiative × year presence table. Every row has exactly
 * {@code years.size()} flags.
 */
public record TimelineMatrix(
    @JsonProperty("years") List<Integer> years,
    @JsonProperty("rows")  List<TimelineRow> rows
) {

    public TimelineMatrix {
        years = List.copyOf(years);
        rows = List.copyOf(rows);
        for (TimelineRow row : rows) {
            if (row.presence().size() != years.size()) {
                throw new IllegalArgumentException("timeline row " + row.name() + " has width "
                    + row.presence().size() + ", expected " + years.size());
            }
        }
    }

    public int width() {
        return years.size();
    }

    public Optional<TimelineRow> row(String name) {
        return rows.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    /**
     * Returns a copy whose rows are ordered by {@code key}. Rows are first put back
     * into source order, then stable-sorted, so the result depends only on the key.
     */
    public TimelineMatrix sortedBy(TimelineSortKey key, Map<String, InitiativeTemporalStats> stats) {
        List<TimelineRow> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparingInt(TimelineRow::sourceIndex));
        sorted.sort(key.comparator(stats));
        return new TimelineMatrix(years, sorted);
    }
}
