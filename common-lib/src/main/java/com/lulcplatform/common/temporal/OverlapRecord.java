package com.lulcplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Year overlap between an unordered pair of initiatives (Jaccard index in percent).
 * {@code first} precedes {@code second} in source-table order.
 */
public record OverlapRecord(
    @JsonProperty("first")             String first,
    @JsonProperty("second")            String second,
    @JsonProperty("overlapYears")      List<Integer> overlapYears,
    @JsonProperty("overlapCount")      int overlapCount,
    @JsonProperty("unionCount")        int unionCount,
    @JsonProperty("overlapPercentage") double overlapPercentage
) {

    public OverlapRecord {
        overlapYears = List.copyOf(overlapYears);
    }

    public boolean involves(String a, String b) {
        return (first.equals(a) && second.equals(b)) || (first.equals(b) && second.equals(a));
    }
}
