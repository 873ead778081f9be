package com.lulcplatform.analytics.dto;

/**
 * Coverage of one initiative over a caller-chosen inclusive year window.
 */
public record CoverageDTO(
    String initiative,
    int startYear,
    int endYear,
    double coveragePercentage
) {}
