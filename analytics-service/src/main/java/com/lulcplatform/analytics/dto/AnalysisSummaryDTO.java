package com.lulcplatform.analytics.dto;

import com.lulcplatform.common.temporal.CoveragePeriod;

import java.time.Instant;
import java.util.List;

/**
 * Headline figures of one session's analysis.
 *
 * <p>Returned by {@code GET /api/v1/analytics/summary} and {@code POST /api/v1/analytics/session/refresh}.
 *
 * @param sessionId                 session the snapshot belongs to
 * @param totalInitiatives          initiatives that survived loading
 * @param withTemporalData          initiatives with at least one decodable year
 * @param period                    global year span, or null when nobody has years
 * @param totalYears                size of the union year axis
 * @param columns                   every column seen in the initiative source
 * @param crops                     crops in the calendar, 0 without a calendar
 * @param notes                     processing notes raised while analysing
 * @param loadedAt                  when the source files were read
 * @param generatedAt               when this summary was produced
 */
public record AnalysisSummaryDTO(
    String sessionId,
    int totalInitiatives,
    int withTemporalData,
    CoveragePeriod period,
    int totalYears,
    List<String> columns,
    int crops,
    List<String> notes,
    Instant loadedAt,
    Instant generatedAt
) {}
