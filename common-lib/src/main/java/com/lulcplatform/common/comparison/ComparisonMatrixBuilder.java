package com.lulcplatform.common.comparison;

import com.lulcplatform.common.model.Initiative;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the normalized multi-criteria comparison matrix.
 *
 * <p>For every tracked metric the range is computed over the initiatives that
 * report it, then each reported value is scaled with {@link MetricNormalizer}.
 * An initiative's {@code overallScore} averages only the metrics it reports, so
 * a missing accuracy lowers neither the accuracy range nor that initiative's
 * composite.
 *
 * <p>Initiatives are keyed by name: a repeated name keeps its first occurrence,
 * as in {@link com.lulcplatform.common.temporal.TemporalCoverageEngine}.
 *
 * <p>Stateless and side-effect free; inputs are never modified.
 */
public final class ComparisonMatrixBuilder {

    private ComparisonMatrixBuilder() {}

    public static ComparisonMatrix build(List<Initiative> initiatives) {
        return build(initiatives, MetricSpec.defaults());
    }

    public static ComparisonMatrix build(List<Initiative> input, List<MetricSpec> metrics) {
        Map<String, Initiative> byName = new LinkedHashMap<>();
        for (Initiative initiative : input) {
            byName.putIfAbsent(initiative.name(), initiative);
        }
        List<Initiative> initiatives = new ArrayList<>(byName.values());

        Map<String, MetricRange> ranges = new LinkedHashMap<>();
        for (MetricSpec metric : metrics) {
            List<Double> values = new ArrayList<>(initiatives.size());
            for (Initiative initiative : initiatives) {
                values.add(initiative.numericValue(metric.column()));
            }
            MetricRange range = MetricNormalizer.range(values);
            if (range != null) {
                ranges.put(metric.column(), range);
            }
        }

        List<ComparisonRow> rows = new ArrayList<>(initiatives.size());
        for (Initiative initiative : initiatives) {
            rows.add(buildRow(initiative, metrics, ranges));
        }
        return new ComparisonMatrix(metrics, ranges, rows);
    }

    private static ComparisonRow buildRow(Initiative initiative,
                                          List<MetricSpec> metrics,
                                          Map<String, MetricRange> ranges) {
        Map<String, Double> rawValues = new LinkedHashMap<>();
        Map<String, Double> scores = new LinkedHashMap<>();

        for (MetricSpec metric : metrics) {
            Double value = initiative.numericValue(metric.column());
            MetricRange range = ranges.get(metric.column());
            if (value == null || range == null) continue;

            rawValues.put(metric.column(), value);
            scores.put(metric.column(), MetricNormalizer.normalize(value, range, metric.polarity()));
        }

        Double overall = scores.isEmpty()
            ? null
            : scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        return new ComparisonRow(initiative.name(), initiative.displayName(), rawValues, scores, overall);
    }
}
