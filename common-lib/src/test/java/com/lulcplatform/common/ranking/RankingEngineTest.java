package com.lulcplatform.common.ranking;

import com.lulcplatform.common.comparison.ComparisonMatrix;
import com.lulcplatform.common.comparison.ComparisonMatrixBuilder;
import com.lulcplatform.common.model.Initiative;
import com.lulcplatform.common.model.InitiativeColumns;
import com.lulcplatform.common.model.InitiativeMetadata;
import com.lulcplatform.common.temporal.TemporalAnalysis;
import com.lulcplatform.common.temporal.TemporalCoverageEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RankingEngineTest {

    private static final double EPS = 1e-9;

    private static Initiative initiative(String name, Object accuracy, Object resolution) {
        Map<String, Object> record = new HashMap<>();
        record.put(InitiativeColumns.NAME, name);
        record.put(InitiativeColumns.ACCURACY_PCT, accuracy);
        record.put(InitiativeColumns.RESOLUTION_M, resolution);
        return Initiative.fromRecord(record);
    }

    private static List<String> names(List<RankingEntry> entries) {
        return entries.stream().map(RankingEntry::name).toList();
    }

    @Test
    @DisplayName("overall ranking is descending with 1-based ranks")
    void overall() {
        ComparisonMatrix matrix = ComparisonMatrixBuilder.build(List.of(
            initiative("A", 80.0, 30),
            initiative("B", 90.0, 10),
            initiative("C", 85.0, 250)));

        List<RankingEntry> overall = RankingEngine.rank(matrix, null).overall();
        assertEquals("B", overall.get(0).name());
        assertEquals(1, overall.get(0).rank());
        assertEquals(3, overall.get(2).rank());
    }

    @Test
    @DisplayName("ties are broken by name")
    void tieBreak() {
        ComparisonMatrix matrix = ComparisonMatrixBuilder.build(List.of(
            initiative("Zeta", 80.0, 30),
            initiative("Alpha", 80.0, 30)));

        assertEquals(List.of("Alpha", "Zeta"), names(RankingEngine.rank(matrix, null).overall()));
    }

    @Test
    @DisplayName("resolution ranks ascending on raw metres, missing values left out")
    void perMetric() {
        ComparisonMatrix matrix = ComparisonMatrixBuilder.build(List.of(
            initiative("A", 80.0, 30),
            initiative("B", 90.0, 10),
            initiative("C", "Incomplete", 250),
            initiative("D", 70.0, null)));

        Rankings rankings = RankingEngine.rank(matrix, null);
        assertEquals(List.of("B", "A", "C"), names(rankings.perMetric().get(InitiativeColumns.RESOLUTION_M)));
        assertEquals(List.of("B", "A", "D"), names(rankings.perMetric().get(InitiativeColumns.ACCURACY_PCT)));
        assertEquals(10.0, rankings.perMetric().get(InitiativeColumns.RESOLUTION_M).get(0).value(), EPS);
    }

    @Test
    @DisplayName("temporal composite rewards longer series")
    void temporalComposite() {
        List<Initiative> initiatives = List.of(
            initiative("A", 80.0, 30),
            initiative("B", 80.0, 30),
            initiative("C", 80.0, 60));
        TemporalAnalysis temporal = TemporalCoverageEngine.analyze(Map.of(
            "A", new InitiativeMetadata("A", "2000-2019"),
            "B", new InitiativeMetadata("B", "2010-2019")), initiatives);

        Rankings rankings = RankingEngine.rank(ComparisonMatrixBuilder.build(initiatives), temporal);

        assertEquals(List.of("A", "B", "C"), names(rankings.temporalComposite()));
        assertEquals(1.0, rankings.temporalComposite().get(0).value(), EPS);
        assertEquals(List.of("A", "B"), names(rankings.temporalCoverage()));
        assertEquals(20.0, rankings.temporalCoverage().get(0).value(), EPS);
    }

    @Test
    @DisplayName("without temporal data the composite equals the overall ranking")
    void noTemporalData() {
        ComparisonMatrix matrix = ComparisonMatrixBuilder.build(List.of(
            initiative("A", 80.0, 30),
            initiative("B", 90.0, 10)));

        Rankings rankings = RankingEngine.rank(matrix, null);
        assertEquals(names(rankings.overall()), names(rankings.temporalComposite()));
        assertTrue(rankings.temporalCoverage().isEmpty());
    }
}
