package com.lulcplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Temporal profile of one initiative.
 *
 * <ul>
 *   <li>{@code coveragePercentage}   – share of the global period (union of all
 *       initiatives' years, first to last) in which this initiative has data.</li>
 *   <li>{@code efficiencyPercentage} – share of its own span ({@code lastYear - firstYear + 1})
 *       in which it has data; 100 for a continuous series.</li>
 *   <li>{@code largestGapDuration}, {@code yearsInGap} – 0 when there are no gaps.</li>
 * </ul>
 *
 * <p>For initiatives without temporal data {@code firstYear}/{@code lastYear} are
 * null and every count is zero.
 */
public record InitiativeTemporalStats(
    @JsonProperty("name")                 String name,
    @JsonProperty("displayName")          String displayName,
    @JsonProperty("years")                List<Integer> years,
    @JsonProperty("firstYear")            Integer firstYear,
    @JsonProperty("lastYear")             Integer lastYear,
    @JsonProperty("totalYears")           int totalYears,
    @JsonProperty("spanYears")            int spanYears,
    @JsonProperty("gaps")                 List<Gap> gaps,
    @JsonProperty("largestGapDuration")   int largestGapDuration,
    @JsonProperty("yearsInGap")           int yearsInGap,
    @JsonProperty("coveragePercentage")   double coveragePercentage,
    @JsonProperty("efficiencyPercentage") double efficiencyPercentage,
    @JsonProperty("continuity")           ContinuityStatus continuity
) {

    public InitiativeTemporalStats {
        years = List.copyOf(years);
        gaps = List.copyOf(gaps);
    }

    public boolean hasTemporalData() {
        return totalYears > 0;
    }
}
