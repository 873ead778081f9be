package com.lulcplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lulcplatform.common.exception.UnknownInitiativeException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of {@link TemporalCoverageEngine#analyze}.
 *
 * <p>{@code period} is null when no initiative has temporal data.
 * {@code initiativesWithoutTemporalData} lists initiatives whose year list decoded
 * to nothing; they still have an all-false timeline row and zeroed statistics.
 */
public record TemporalAnalysis(
    @JsonProperty("unionYears")                     List<Integer> unionYears,
    @JsonProperty("period")                         CoveragePeriod period,
    @JsonProperty("timeline")                       TimelineMatrix timeline,
    @JsonProperty("stats")                          Map<String, InitiativeTemporalStats> stats,
    @JsonProperty("pairwiseOverlap")                List<OverlapRecord> pairwiseOverlap,
    @JsonProperty("initiativesWithoutTemporalData") List<String> initiativesWithoutTemporalData,
    @JsonProperty("yearlyInitiativeCounts")         Map<Integer, Integer> yearlyInitiativeCounts,
    @JsonProperty("notes")                          List<String> notes
) {

    public TemporalAnalysis {
        unionYears = List.copyOf(unionYears);
        stats = Collections.unmodifiableMap(new LinkedHashMap<>(stats));
        pairwiseOverlap = List.copyOf(pairwiseOverlap);
        initiativesWithoutTemporalData = List.copyOf(initiativesWithoutTemporalData);
        yearlyInitiativeCounts = Collections.unmodifiableMap(new LinkedHashMap<>(yearlyInitiativeCounts));
        notes = List.copyOf(notes);
    }

    /**
     * Coverage of one initiative over a caller-chosen window, recomputed on every call.
     *
     * @throws UnknownInitiativeException when {@code name} is not part of this analysis
     * @throws com.lulcplatform.common.exception.InvalidYearWindowException when {@code startYear > endYear}
     */
    public double coverage(String name, int startYear, int endYear) {
        InitiativeTemporalStats initiative = stats.get(name);
        if (initiative == null) {
            throw new UnknownInitiativeException(name);
        }
        return TemporalCoverageEngine.coveragePercentage(initiative.years(), startYear, endYear);
    }

    public Optional<OverlapRecord> overlap(String a, String b) {
        return pairwiseOverlap.stream().filter(o -> o.involves(a, b)).findFirst();
    }

    public TimelineMatrix timeline(TimelineSortKey key) {
        return timeline.sortedBy(key, stats);
    }

    /** Same analysis with the timeline rows in {@code key} order. */
    public TemporalAnalysis sortedBy(TimelineSortKey key) {
        return new TemporalAnalysis(unionYears, period, timeline(key), stats, pairwiseOverlap,
            initiativesWithoutTemporalData, yearlyInitiativeCounts, notes);
    }

    /** Largest {@code totalYears} across initiatives; 0 when nobody has data. */
    public int maxTotalYears() {
        return stats.values().stream().mapToInt(InitiativeTemporalStats::totalYears).max().orElse(0);
    }
}
