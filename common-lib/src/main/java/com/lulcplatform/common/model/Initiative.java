package com.lulcplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the initiative table. Immutable for the duration of an analysis run.
 *
 * <ul>
 *   <li>{@code resolutionM}  – spatial resolution in metres; lower is better. Null when not reported.</li>
 *   <li>{@code accuracyPct}  – overall accuracy 0–100. Null when not reported; sentinels such
 *       as "Not informed" are never read as 0.</li>
 *   <li>{@code numClasses}   – number of legend classes. Null when not reported.</li>
 *   <li>{@code attributes}   – the untouched source record, so callers can group or rank on
 *       any other column.</li>
 * </ul>
 */
public record Initiative(
    @JsonProperty("name")         String name,
    @JsonProperty("acronym")      String acronym,
    @JsonProperty("scope")        String scope,
    @JsonProperty("resolutionM")  Double resolutionM,
    @JsonProperty("accuracyPct")  Double accuracyPct,
    @JsonProperty("numClasses")   Integer numClasses,
    @JsonProperty("methodology")  String methodology,
    @JsonProperty("provider")     String provider,
    @JsonIgnore                   Map<String, Object> attributes
) {

    public Initiative {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Builds an initiative from a flat loader record. Bad cells become nulls; the
     * only hard requirement is a non-blank {@code name}.
     *
     * @throws IllegalArgumentException when the record has no usable name
     */
    public static Initiative fromRecord(Map<String, Object> record) {
        String name = CellValues.toText(record.get(InitiativeColumns.NAME));
        if (name == null) {
            throw new IllegalArgumentException("initiative record without a name: " + record.keySet());
        }
        Double classes = CellValues.toPositiveDouble(record.get(InitiativeColumns.NUM_CLASSES));
        return new Initiative(
            name,
            CellValues.toText(record.get(InitiativeColumns.ACRONYM)),
            rawCategory(record.get(InitiativeColumns.SCOPE)),
            CellValues.toPositiveDouble(record.get(InitiativeColumns.RESOLUTION_M)),
            accuracy(record.get(InitiativeColumns.ACCURACY_PCT)),
            classes == null ? null : (int) Math.round(classes),
            rawCategory(record.get(InitiativeColumns.METHODOLOGY)),
            rawCategory(record.get(InitiativeColumns.PROVIDER)),
            record
        );
    }

    /** Acronym when present, otherwise the full name. */
    @JsonProperty("displayName")
    public String displayName() {
        return acronym != null ? acronym : name;
    }

    /**
     * Numeric value of any column. The three typed metrics are served from their
     * parsed fields; other columns are parsed leniently from the raw record.
     */
    public Double numericValue(String column) {
        return switch (column) {
            case InitiativeColumns.RESOLUTION_M -> resolutionM;
            case InitiativeColumns.ACCURACY_PCT -> accuracyPct;
            case InitiativeColumns.NUM_CLASSES  -> numClasses == null ? null : numClasses.doubleValue();
            default -> CellValues.toDouble(attributes.get(column));
        };
    }

    /** Categorical value of any column, or {@code null} when missing or blank. */
    public String categoricalValue(String column) {
        return switch (column) {
            case InitiativeColumns.NAME        -> name;
            case InitiativeColumns.SCOPE       -> scope;
            case InitiativeColumns.METHODOLOGY -> methodology;
            case InitiativeColumns.PROVIDER    -> provider;
            default -> rawCategory(attributes.get(column));
        };
    }

    private static String rawCategory(Object cell) {
        String text = CellValues.toText(cell);
        return CellValues.isMissingSentinel(text) ? null : text;
    }

    private static Double accuracy(Object cell) {
        Double value = CellValues.toDouble(cell);
        if (value == null || value < 0.0 || value > 100.0) return null;
        return value;
    }
}
