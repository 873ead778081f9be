package com.lulcplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InitiativeTest {

    @Test
    @DisplayName("typed columns are parsed from numbers and unit strings")
    void parsesTypedColumns() {
        Initiative initiative = Initiative.fromRecord(Map.of(
            "name", "MapBiomas Brazil",
            "acronym", "MapBiomas",
            "scope", "National",
            "resolution_m", "30 m",
            "accuracy_pct", "89.5%",
            "num_classes", 27,
            "methodology", "Machine Learning",
            "provider", "MapBiomas Network"));

        assertEquals("MapBiomas Brazil", initiative.name());
        assertEquals("MapBiomas", initiative.displayName());
        assertEquals(30.0, initiative.resolutionM());
        assertEquals(89.5, initiative.accuracyPct());
        assertEquals(27, initiative.numClasses());
        assertEquals("National", initiative.categoricalValue(InitiativeColumns.SCOPE));
    }

    @Test
    @DisplayName("accuracy sentinels are missing, not zero")
    void accuracySentinels() {
        for (String sentinel : new String[] { "Not informed", "Incomplete", "N/A", "not available", "" }) {
            Initiative initiative = Initiative.fromRecord(Map.of("name", "X", "accuracy_pct", sentinel));
            assertNull(initiative.accuracyPct(), "sentinel '" + sentinel + "' should be missing");
        }
    }

    @Test
    @DisplayName("non-positive resolution and out-of-range accuracy are missing")
    void invalidNumbers() {
        Initiative initiative = Initiative.fromRecord(Map.of(
            "name", "X", "resolution_m", 0, "accuracy_pct", 140, "num_classes", -3));
        assertNull(initiative.resolutionM());
        assertNull(initiative.accuracyPct());
        assertNull(initiative.numClasses());
    }

    @Test
    @DisplayName("record without a name is rejected")
    void requiresName() {
        Map<String, Object> record = new HashMap<>();
        record.put("name", "  ");
        assertThrows(IllegalArgumentException.class, () -> Initiative.fromRecord(record));
    }

    @Test
    @DisplayName("other columns are served from the raw record")
    void rawColumns() {
        Initiative initiative = Initiative.fromRecord(Map.of(
            "name", "X", "country", "Brazil", "num_agri_classes", "4"));
        assertEquals("Brazil", initiative.categoricalValue("country"));
        assertEquals(4.0, initiative.numericValue("num_agri_classes"));
        assertNull(initiative.categoricalValue("missing_column"));
    }

    @Test
    @DisplayName("legacy metadata key is accepted")
    void legacyMetadataKey() {
        InitiativeMetadata metadata = InitiativeMetadata.fromRecord("X", Map.of("anos_disponiveis", "2015-2016"));
        assertEquals("2015-2016", metadata.availableYears());
    }
}
