package com.lulcplatform.analytics.service;

import com.lulcplatform.analytics.dto.AnalysisSummaryDTO;
import com.lulcplatform.analytics.dto.CoverageDTO;
import com.lulcplatform.analytics.loader.DataLocations;
import com.lulcplatform.analytics.loader.JsoncDataLoader;
import com.lulcplatform.analytics.loader.LoadedSources;
import com.lulcplatform.analytics.session.AnalysisSessionCache;
import com.lulcplatform.analytics.session.AnalysisSnapshot;
import com.lulcplatform.common.calendar.CalendarAggregation;
import com.lulcplatform.common.calendar.CalendarAggregator;
import com.lulcplatform.common.calendar.CalendarValidation;
import com.lulcplatform.common.calendar.CalendarValidator;
import com.lulcplatform.common.comparison.ComparisonMatrix;
import com.lulcplatform.common.comparison.ComparisonMatrixBuilder;
import com.lulcplatform.common.grouping.ClassAnalysis;
import com.lulcplatform.common.grouping.ClassAnalyzer;
import com.lulcplatform.common.grouping.GroupAggregation;
import com.lulcplatform.common.grouping.GroupAggregator;
import com.lulcplatform.common.model.Initiative;
import com.lulcplatform.common.model.InitiativeColumns;
import com.lulcplatform.common.ranking.RankingEngine;
import com.lulcplatform.common.ranking.Rankings;
import com.lulcplatform.common.temporal.TemporalAnalysis;
import com.lulcplatform.common.temporal.TemporalCoverageEngine;
import com.lulcplatform.common.temporal.TimelineSortKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point of the service layer. Resolves the caller's session snapshot
 * (loading and analysing the sources on a miss) and derives the requested view
 * from it.
 *
 * <p>All core work is synchronous and runs on {@link Schedulers#boundedElastic()};
 * file reads happen there too.
 */
@Service
public class ComparativeAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(ComparativeAnalyticsService.class);

    public static final String DEFAULT_SESSION = "default";

    private final JsoncDataLoader loader;
    private final DataLocations locations;
    private final AnalysisSessionCache cache;

    public ComparativeAnalyticsService(JsoncDataLoader loader, DataLocations locations, AnalysisSessionCache cache) {
        this.loader = loader;
        this.locations = locations;
        this.cache = cache;
    }

    // ── Session ────────────────────────────────────────────────────

    public Mono<AnalysisSnapshot> snapshot(String sessionId) {
        String session = normalizeSession(sessionId);
        return Mono.fromCallable(() -> {
                AnalysisSnapshot cached = cache.get(session);
                if (cached != null) {
                    return cached;
                }
                AnalysisSnapshot fresh = analyze(session, loader.load(locations));
                cache.put(fresh);
                return fresh;
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnError(e -> log.error("Snapshot build failed. session={}", session, e));
    }

    public Mono<AnalysisSummaryDTO> refresh(String sessionId) {
        String session = normalizeSession(sessionId);
        log.info("Session refresh requested. session={}", session);
        return Mono.fromRunnable(() -> cache.evict(session))
            .then(summary(session));
    }

    // ── Views ──────────────────────────────────────────────────────

    public Mono<ComparisonMatrix> comparison(String sessionId) {
        return snapshot(sessionId).map(AnalysisSnapshot::comparison);
    }

    public Mono<TemporalAnalysis> temporal(String sessionId, String sort) {
        TimelineSortKey key = TimelineSortKey.fromParameter(sort);
        return snapshot(sessionId).map(s -> s.temporal().sortedBy(key));
    }

    public Mono<CoverageDTO> coverage(String sessionId, String initiative, Integer startYear, Integer endYear) {
        return snapshot(sessionId).map(s -> {
            TemporalAnalysis temporal = s.temporal();
            int start = startYear != null ? startYear : periodStart(temporal);
            int end = endYear != null ? endYear : periodEnd(temporal);
            return new CoverageDTO(initiative, start, end, temporal.coverage(initiative, start, end));
        });
    }

    public Mono<GroupAggregation> groups(String sessionId, String by, String metric) {
        String groupColumn = by == null || by.isBlank() ? InitiativeColumns.METHODOLOGY : by.trim();
        String metricColumn = metric == null || metric.isBlank() ? InitiativeColumns.ACCURACY_PCT : metric.trim();
        return snapshot(sessionId)
            .publishOn(Schedulers.boundedElastic())
            .map(s -> GroupAggregator.aggregate(s.sources().initiatives(), groupColumn, metricColumn));
    }

    public Mono<ClassAnalysis> classes(String sessionId) {
        return snapshot(sessionId).map(AnalysisSnapshot::classes);
    }

    public Mono<Rankings> rankings(String sessionId) {
        return snapshot(sessionId).map(AnalysisSnapshot::rankings);
    }

    public Mono<CalendarAggregation> calendar(String sessionId, String crop) {
        String cropFilter = crop == null || crop.isBlank() ? null : crop.trim();
        return snapshot(sessionId)
            .publishOn(Schedulers.boundedElastic())
            .map(s -> {
                CalendarAggregation aggregation =
                    CalendarAggregator.aggregate(s.sources().cropCalendar().crops(), cropFilter);
                aggregation.notes().forEach(note ->
                    log.warn("[Calendar] session={} crop={} note={}", s.sessionId(), cropFilter, note));
                return aggregation;
            });
    }

    public Mono<CalendarValidation> calendarValidation(String sessionId) {
        return snapshot(sessionId).map(AnalysisSnapshot::calendarValidation);
    }

    public Mono<AnalysisSummaryDTO> summary(String sessionId) {
        return snapshot(sessionId).map(this::toSummary);
    }

    // ── Analysis ───────────────────────────────────────────────────

    AnalysisSnapshot analyze(String session, LoadedSources sources) {
        long start = System.currentTimeMillis();
        List<Initiative> initiatives = sources.initiatives();

        ComparisonMatrix comparison = ComparisonMatrixBuilder.build(initiatives);
        TemporalAnalysis temporal = TemporalCoverageEngine.analyze(sources.metadata(), initiatives);
        Rankings rankings = RankingEngine.rank(comparison, temporal);
        ClassAnalysis classes = ClassAnalyzer.analyze(initiatives);
        CalendarValidation validation = CalendarValidator.validate(sources.rawCropCalendar());

        temporal.notes().forEach(note -> log.warn("[Temporal] session={} note={}", session, note));
        validation.issues().forEach(issue -> log.warn("[Calendar] session={} issue={}", session, issue));

        log.info("Analysis built. session={} initiatives={} withYears={} years={} elapsedMs={}",
            session, initiatives.size(),
            initiatives.size() - temporal.initiativesWithoutTemporalData().size(),
            temporal.unionYears().size(), System.currentTimeMillis() - start);

        return new AnalysisSnapshot(session, sources, comparison, temporal, rankings, classes,
            validation, cache.now());
    }

    private AnalysisSummaryDTO toSummary(AnalysisSnapshot snapshot) {
        List<Initiative> initiatives = snapshot.sources().initiatives();
        TemporalAnalysis temporal = snapshot.temporal();

        Set<String> columns = new LinkedHashSet<>();
        initiatives.forEach(i -> columns.addAll(i.attributes().keySet()));

        List<String> notes = new ArrayList<>(temporal.notes());
        notes.addAll(snapshot.calendarValidation().issues());

        return new AnalysisSummaryDTO(
            snapshot.sessionId(),
            initiatives.size(),
            initiatives.size() - temporal.initiativesWithoutTemporalData().size(),
            temporal.period(),
            temporal.unionYears().size(),
            new ArrayList<>(columns),
            snapshot.sources().cropCalendar().crops().size(),
            notes,
            snapshot.sources().loadedAt(),
            cache.now());
    }

    private static int periodStart(TemporalAnalysis temporal) {
        return temporal.period() == null ? 0 : temporal.period().startYear();
    }

    private static int periodEnd(TemporalAnalysis temporal) {
        return temporal.period() == null ? 0 : temporal.period().endYear();
    }

    static String normalizeSession(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION : sessionId.trim();
    }
}
