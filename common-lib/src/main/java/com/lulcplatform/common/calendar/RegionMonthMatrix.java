package com.lulcplatform.common.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Month;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dense region × month count matrix. Columns are always January … December.
 * Instances are immutable; {@link Builder} is used while tallying.
 */
public final class RegionMonthMatrix {

    private final List<String> regions;
    private final int[][] cells;

    private RegionMonthMatrix(List<String> regions, int[][] cells) {
        this.regions = List.copyOf(regions);
        this.cells = cells;
    }

    @JsonProperty("regions")
    public List<String> regions() {
        return regions;
    }

    @JsonProperty("months")
    public List<String> months() {
        return CalendarMonths.LABELS;
    }

    @JsonProperty("cells")
    public List<List<Integer>> cells() {
        List<List<Integer>> rows = new ArrayList<>(cells.length);
        for (int[] row : cells) {
            rows.add(Arrays.stream(row).boxed().toList());
        }
        return rows;
    }

    /** @return the count, or 0 for a region that is not in the matrix */
    public int get(String region, Month month) {
        int r = regions.indexOf(region);
        return r < 0 ? 0 : cells[r][month.ordinal()];
    }

    public int regionTotal(String region) {
        int r = regions.indexOf(region);
        return r < 0 ? 0 : Arrays.stream(cells[r]).sum();
    }

    public int monthTotal(Month month) {
        int sum = 0;
        for (int[] row : cells) {
            sum += row[month.ordinal()];
        }
        return sum;
    }

    @JsonProperty("total")
    public int total() {
        int sum = 0;
        for (int[] row : cells) {
            sum += Arrays.stream(row).sum();
        }
        return sum;
    }

    /** Cell-wise sum of two matrices over the same regions. */
    public RegionMonthMatrix plus(RegionMonthMatrix other) {
        if (!regions.equals(other.regions)) {
            throw new IllegalArgumentException("matrices cover different regions");
        }
        int[][] sum = new int[cells.length][12];
        for (int r = 0; r < cells.length; r++) {
            for (int m = 0; m < 12; m++) {
                sum[r][m] = cells[r][m] + other.cells[r][m];
            }
        }
        return new RegionMonthMatrix(regions, sum);
    }

    static final class Builder {
        private final List<String> regions;
        private final int[][] cells;

        Builder(List<String> regions) {
            this.regions = List.copyOf(regions);
            this.cells = new int[regions.size()][12];
        }

        void increment(String region, Month month) {
            cells[regions.indexOf(region)][month.ordinal()]++;
        }

        RegionMonthMatrix build() {
            int[][] copy = new int[cells.length][];
            for (int r = 0; r < cells.length; r++) {
                copy[r] = cells[r].clone();
            }
            return new RegionMonthMatrix(regions, copy);
        }
    }
}
