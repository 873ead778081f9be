package com.lulcplatform.common.year;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Canonical year list plus the processing notes produced while decoding it.
 * {@code years} is strictly ascending and duplicate-free; it is empty when
 * nothing could be decoded.
 */
public record YearListResult(
    @JsonProperty("years") List<Integer> years,
    @JsonProperty("notes") List<String>  notes
) {

    public YearListResult {
        years = List.copyOf(years);
        notes = List.copyOf(notes);
    }

    public boolean isEmpty() {
        return years.isEmpty();
    }
}
