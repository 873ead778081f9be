package com.lulcplatform.common.ranking;

import com.lulcplatform.common.comparison.ComparisonMatrix;
import com.lulcplatform.common.comparison.ComparisonRow;
import com.lulcplatform.common.comparison.MetricPolarity;
import com.lulcplatform.common.comparison.MetricSpec;
import com.lulcplatform.common.temporal.InitiativeTemporalStats;
import com.lulcplatform.common.temporal.TemporalAnalysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composes comparison scores and temporal statistics into rankings.
 *
 * <p><b>Tie-break</b> (all rankings): equal values are ordered by initiative name,
 * ascending. Ranks are 1-based positions after sorting.
 *
 * <p><b>Temporal composite</b>: for initiatives with temporal data the extra score
 * <pre>
 *   totalYears / max(totalYears over all initiatives)
 * </pre>
 * is averaged together with the initiative's normalized metric scores. Initiatives
 * without temporal data keep their plain overall score. When nobody has temporal
 * data the composite equals the overall ranking.
 */
public final class RankingEngine {

    private static final Comparator<Scored> DESCENDING =
        Comparator.comparingDouble(Scored::value).reversed().thenComparing(Scored::name);

    private static final Comparator<Scored> ASCENDING =
        Comparator.comparingDouble(Scored::value).thenComparing(Scored::name);

    private RankingEngine() {}

    /**
     * @param matrix   comparison matrix of the current table
     * @param temporal temporal analysis of the same table; may be null
     */
    public static Rankings rank(ComparisonMatrix matrix, TemporalAnalysis temporal) {
        // ── Overall ────────────────────────────────────────────────
        List<Scored> overall = new ArrayList<>();
        for (ComparisonRow row : matrix.rows()) {
            if (row.overallScore() != null) {
                overall.add(new Scored(row.name(), row.displayName(), row.overallScore()));
            }
        }

        // ── Per metric, raw values ─────────────────────────────────
        Map<String, List<RankingEntry>> perMetric = new LinkedHashMap<>();
        for (MetricSpec metric : matrix.metrics()) {
            List<Scored> values = new ArrayList<>();
            for (ComparisonRow row : matrix.rows()) {
                Double raw = row.rawValues().get(metric.column());
                if (raw != null) {
                    values.add(new Scored(row.name(), row.displayName(), raw));
                }
            }
            Comparator<Scored> order = metric.polarity() == MetricPolarity.LOWER_IS_BETTER ? ASCENDING : DESCENDING;
            perMetric.put(metric.column(), toEntries(values, order));
        }

        // ── Temporal composite and coverage ────────────────────────
        List<Scored> composite = new ArrayList<>();
        List<Scored> coverage = new ArrayList<>();
        int maxYears = temporal == null ? 0 : temporal.maxTotalYears();
        for (ComparisonRow row : matrix.rows()) {
            InitiativeTemporalStats stats = temporal == null ? null : temporal.stats().get(row.name());
            boolean hasYears = stats != null && stats.hasTemporalData() && maxYears > 0;

            List<Double> parts = new ArrayList<>(row.scores().values());
            if (hasYears) {
                parts.add((double) stats.totalYears() / maxYears);
                coverage.add(new Scored(row.name(), row.displayName(), stats.totalYears()));
            }
            if (!parts.isEmpty()) {
                double mean = parts.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
                composite.add(new Scored(row.name(), row.displayName(), mean));
            }
        }

        return new Rankings(
            toEntries(overall, DESCENDING),
            perMetric,
            toEntries(composite, DESCENDING),
            toEntries(coverage, DESCENDING));
    }

    private static List<RankingEntry> toEntries(List<Scored> scored, Comparator<Scored> order) {
        List<Scored> sorted = new ArrayList<>(scored);
        sorted.sort(order);
        List<RankingEntry> entries = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            Scored s = sorted.get(i);
            entries.add(new RankingEntry(i + 1, s.name(), s.displayName(), s.value()));
        }
        return entries;
    }

    private record Scored(String name, String displayName, double value) {}
}
