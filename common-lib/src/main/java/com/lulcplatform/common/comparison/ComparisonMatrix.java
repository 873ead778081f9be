package com.lulcplatform.common.comparison;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of {@link ComparisonMatrixBuilder}: the tracked metrics, the observed
 * range of each (absent when nobody reports it) and one row per initiative in
 * source-table order.
 */
public record ComparisonMatrix(
    @JsonProperty("metrics") List<MetricSpec> metrics,
    @JsonProperty("ranges")  Map<String, MetricRange> ranges,
    @JsonProperty("rows")    List<ComparisonRow> rows
) {

    public ComparisonMatrix {
        metrics = List.copyOf(metrics);
        ranges = Collections.unmodifiableMap(new LinkedHashMap<>(ranges));
        rows = List.copyOf(rows);
    }

    public Optional<ComparisonRow> row(String name) {
        return rows.stream().filter(r -> r.name().equals(name)).findFirst();
    }
}
