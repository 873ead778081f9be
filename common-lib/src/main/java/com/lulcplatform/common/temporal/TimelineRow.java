package com.lulcplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One initiative's presence flags over the union years of a {@link TimelineMatrix}.
 * {@code sourceIndex} is the initiative's position in the source table and anchors
 * every display sort.
 */
public record TimelineRow(
    @JsonProperty("name")        String name,
    @JsonProperty("displayName") String displayName,
    @JsonIgnore                  int sourceIndex,
    @JsonIgnore                  List<Boolean> presence
) {

    public TimelineRow {
        presence = List.copyOf(presence);
    }

    public boolean isPresent(int yearIndex) {
        return presence.get(yearIndex);
    }

    /** Presence as 0/1 flags, the shape heatmap consumers expect. */
    @JsonProperty("availability")
    public List<Integer> availability() {
        return presence.stream().map(p -> p ? 1 : 0).toList();
    }
}
