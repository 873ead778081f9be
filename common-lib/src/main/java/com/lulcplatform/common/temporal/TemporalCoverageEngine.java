package com.lulcplatform.common.temporal;

import com.lulcplatform.common.exception.InvalidYearWindowException;
import com.lulcplatform.common.model.Initiative;
import com.lulcplatform.common.model.InitiativeMetadata;
import com.lulcplatform.common.year.YearListNormalizer;
import com.lulcplatform.common.year.YearListResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns sparse per-initiative year lists into the dense temporal view used by the
 * coverage, gap and overlap charts.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>Normalize each initiative's {@code available_years} with {@link YearListNormalizer}.</li>
 *   <li>Union all years into the global, sorted year axis.</li>
 *   <li>Build one presence row per initiative over that axis.</li>
 *   <li>Detect gaps and derive per-initiative statistics.</li>
 *   <li>Compute the year overlap of every unordered pair with data.</li>
 * </ol>
 *
 * <p>Rows follow the initiative table order. Initiatives without metadata or with
 * an undecodable year list are kept with an all-false row and listed in
 * {@link TemporalAnalysis#initiativesWithoutTemporalData()}; they take no part in
 * overlap computation. Metadata entries that match no initiative are ignored and
 * noted.
 *
 * <p>Pure function; the pairwise step is O(n²) in the number of initiatives, which
 * is fine at dashboard scale.
 */
public final class TemporalCoverageEngine {

    private TemporalCoverageEngine() {}

    public static TemporalAnalysis analyze(Map<String, InitiativeMetadata> metadata,
                                           List<Initiative> initiatives) {
        List<String> notes = new ArrayList<>();

        // ── 1. Normalize year lists in table order ────────────────────
        Map<String, Initiative> byName = new LinkedHashMap<>();
        Map<String, List<Integer>> yearsByName = new LinkedHashMap<>();
        for (Initiative initiative : initiatives) {
            if (byName.containsKey(initiative.name())) {
                notes.add("duplicate initiative '" + initiative.name() + "' ignored");
                continue;
            }
            byName.put(initiative.name(), initiative);

            InitiativeMetadata meta = metadata.get(initiative.name());
            if (meta == null) {
                notes.add("no metadata for '" + initiative.name() + "'");
                yearsByName.put(initiative.name(), List.of());
                continue;
            }
            YearListResult result = YearListNormalizer.normalize(meta.availableYears());
            for (String note : result.notes()) {
                notes.add("'" + initiative.name() + "': " + note);
            }
            yearsByName.put(initiative.name(), result.years());
        }
        for (String name : metadata.keySet()) {
            if (!byName.containsKey(name)) {
                notes.add("metadata for unknown initiative '" + name + "' ignored");
            }
        }

        // ── 2. Union years ────────────────────────────────────────────
        TreeSet<Integer> union = new TreeSet<>();
        yearsByName.values().forEach(union::addAll);
        List<Integer> unionYears = new ArrayList<>(union);
        CoveragePeriod period = unionYears.isEmpty()
            ? null
            : new CoveragePeriod(unionYears.get(0), unionYears.get(unionYears.size() - 1));

        // ── 3. Timeline rows and 4. per-initiative statistics ─────────
        List<TimelineRow> rows = new ArrayList<>();
        Map<String, InitiativeTemporalStats> stats = new LinkedHashMap<>();
        List<String> withoutData = new ArrayList<>();
        int index = 0;
        for (Map.Entry<String, List<Integer>> entry : yearsByName.entrySet()) {
            Initiative initiative = byName.get(entry.getKey());
            List<Integer> years = entry.getValue();

            rows.add(new TimelineRow(initiative.name(), initiative.displayName(), index++,
                presence(years, unionYears)));
            stats.put(initiative.name(), buildStats(initiative, years, period));
            if (years.isEmpty()) {
                withoutData.add(initiative.name());
            }
        }

        // ── 5. Pairwise overlap ───────────────────────────────────────
        List<String> withData = new ArrayList<>();
        yearsByName.forEach((name, years) -> {
            if (!years.isEmpty()) withData.add(name);
        });
        List<OverlapRecord> overlaps = new ArrayList<>();
        for (int i = 0; i < withData.size(); i++) {
            for (int j = i + 1; j < withData.size(); j++) {
                String a = withData.get(i);
                String b = withData.get(j);
                overlaps.add(overlap(a, yearsByName.get(a), b, yearsByName.get(b)));
            }
        }

        Map<Integer, Integer> yearlyCounts = new LinkedHashMap<>();
        for (Integer year : unionYears) {
            int count = 0;
            for (List<Integer> years : yearsByName.values()) {
                if (years.contains(year)) count++;
            }
            yearlyCounts.put(year, count);
        }

        return new TemporalAnalysis(unionYears, period, new TimelineMatrix(unionYears, rows),
            stats, overlaps, withoutData, yearlyCounts, notes);
    }

    // ── Building blocks ────────────────────────────────────────────

    /**
     * Gaps of a sorted, duplicate-free year list: one gap for every adjacent pair
     * further apart than one year. Lists with fewer than two years have none.
     */
    public static List<Gap> detectGaps(List<Integer> years) {
        List<Gap> gaps = new ArrayList<>();
        for (int i = 0; i + 1 < years.size(); i++) {
            int current = years.get(i);
            int next = years.get(i + 1);
            if (next - current > 1) {
                gaps.add(Gap.between(current, next));
            }
        }
        return gaps;
    }

    /**
     * Percentage of the inclusive window {@code [startYear, endYear]} in which the
     * initiative has data.
     *
     * @throws InvalidYearWindowException when {@code startYear > endYear}
     */
    public static double coveragePercentage(List<Integer> years, int startYear, int endYear) {
        if (startYear > endYear) {
            throw new InvalidYearWindowException(startYear, endYear);
        }
        long inWindow = years.stream().filter(y -> y >= startYear && y <= endYear).count();
        long windowYears = (long) endYear - startYear + 1;
        return (double) inWindow / windowYears * 100.0;
    }

    /**
     * Jaccard overlap of two year sets in percent; 0 when both are empty.
     */
    public static OverlapRecord overlap(String first, List<Integer> firstYears,
                                        String second, List<Integer> secondYears) {
        Set<Integer> other = new HashSet<>(secondYears);
        TreeSet<Integer> intersection = new TreeSet<>();
        for (Integer year : firstYears) {
            if (other.contains(year)) intersection.add(year);
        }
        Set<Integer> union = new HashSet<>(firstYears);
        union.addAll(secondYears);

        double percentage = union.isEmpty() ? 0.0 : (double) intersection.size() / union.size() * 100.0;
        return new OverlapRecord(first, second, new ArrayList<>(intersection),
            intersection.size(), union.size(), percentage);
    }

    static List<Boolean> presence(List<Integer> years, List<Integer> unionYears) {
        Set<Integer> lookup = new HashSet<>(years);
        List<Boolean> flags = new ArrayList<>(unionYears.size());
        for (Integer year : unionYears) {
            flags.add(lookup.contains(year));
        }
        return flags;
    }

    private static InitiativeTemporalStats buildStats(Initiative initiative, List<Integer> years,
                                                      CoveragePeriod period) {
        if (years.isEmpty()) {
            return new InitiativeTemporalStats(initiative.name(), initiative.displayName(), years,
                null, null, 0, 0, List.of(), 0, 0, 0.0, 0.0, ContinuityStatus.NO_DATA);
        }

        int first = years.get(0);
        int last = years.get(years.size() - 1);
        int span = last - first + 1;
        List<Gap> gaps = detectGaps(years);
        int largestGap = gaps.stream().mapToInt(Gap::duration).max().orElse(0);
        int yearsInGap = gaps.stream().mapToInt(Gap::duration).sum();

        double coverage = coveragePercentage(years, period.startYear(), period.endYear());
        double efficiency = (double) years.size() / span * 100.0;

        return new InitiativeTemporalStats(initiative.name(), initiative.displayName(), years,
            first, last, years.size(), span, gaps, largestGap, yearsInGap, coverage, efficiency,
            gaps.isEmpty() ? ContinuityStatus.CONTINUOUS : ContinuityStatus.WITH_GAPS);
    }
}
