package com.lulcplatform.analytics.session;

import com.lulcplatform.analytics.loader.LoadedSources;
import com.lulcplatform.common.calendar.CalendarValidation;
import com.lulcplatform.common.comparison.ComparisonMatrix;
import com.lulcplatform.common.grouping.ClassAnalysis;
import com.lulcplatform.common.ranking.Rankings;
import com.lulcplatform.common.temporal.TemporalAnalysis;

import java.time.Instant;

/**
 * Immutable per-session analysis state: the loaded sources plus the derived
 * results that do not depend on request parameters.
 *
 * <p>Expiry is decided by {@link AnalysisSessionCache} from {@code createdAt}.
 */
public record AnalysisSnapshot(
    String sessionId,
    LoadedSources sources,
    ComparisonMatrix comparison,
    TemporalAnalysis temporal,
    Rankings rankings,
    ClassAnalysis classes,
    CalendarValidation calendarValidation,
    Instant createdAt
) {}
