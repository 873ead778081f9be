package com.lulcplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Per-initiative metadata record. Only the raw year-list value is needed by the
 * core; its encoding is resolved by {@code YearListNormalizer}.
 */
public record InitiativeMetadata(
    @JsonProperty("name")           String name,
    @JsonProperty("availableYears") Object availableYears
) {

    public static final String AVAILABLE_YEARS = "available_years";
    static final String LEGACY_AVAILABLE_YEARS = "anos_disponiveis";

    public static InitiativeMetadata fromRecord(String name, Map<String, Object> record) {
        if (record == null) {
            return new InitiativeMetadata(name, null);
        }
        Object years = record.get(AVAILABLE_YEARS);
        if (years == null) {
            years = record.get(LEGACY_AVAILABLE_YEARS);
        }
        return new InitiativeMetadata(name, years);
    }
}
