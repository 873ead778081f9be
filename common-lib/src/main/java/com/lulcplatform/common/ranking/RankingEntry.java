package com.lulcplatform.common.ranking;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One position in a ranking. {@code rank} is 1-based; {@code value} is whatever
 * the ranking orders by (a score, or a raw metric value for per-metric rankings).
 */
public record RankingEntry(
    @JsonProperty("rank")        int rank,
    @JsonProperty("name")        String name,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("value")       double value
) {}
