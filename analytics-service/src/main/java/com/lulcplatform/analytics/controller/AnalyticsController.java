package com.lulcplatform.analytics.controller;

import com.lulcplatform.analytics.dto.AnalysisSummaryDTO;
import com.lulcplatform.analytics.dto.CoverageDTO;
import com.lulcplatform.analytics.dto.ErrorDTO;
import com.lulcplatform.analytics.loader.DataLoadException;
import com.lulcplatform.analytics.service.ComparativeAnalyticsService;
import com.lulcplatform.common.calendar.CalendarAggregation;
import com.lulcplatform.common.calendar.CalendarValidation;
import com.lulcplatform.common.comparison.ComparisonMatrix;
import com.lulcplatform.common.exception.AnalyticsException;
import com.lulcplatform.common.exception.InvalidYearWindowException;
import com.lulcplatform.common.exception.UnknownInitiativeException;
import com.lulcplatform.common.grouping.ClassAnalysis;
import com.lulcplatform.common.grouping.GroupAggregation;
import com.lulcplatform.common.ranking.Rankings;
import com.lulcplatform.common.temporal.TemporalAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Read-only REST API over the comparative analysis of the configured sources.
 * Every call is scoped to the session named by {@code X-Session-Id}.
 */
@RestController
@RequestMapping("/api/v1/analytics")
public class AnalyticsController {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsController.class);

    static final String SESSION_HEADER = "X-Session-Id";

    private final ComparativeAnalyticsService analyticsService;

    public AnalyticsController(ComparativeAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/comparison")
    public Mono<ResponseEntity<Object>> comparison(
            @RequestHeader(value = SESSION_HEADER, required = false) String session) {
        Mono<ComparisonMatrix> result = analyticsService.comparison(session);
        return respond(result, "comparison", session);
    }

    @GetMapping("/temporal")
    public Mono<ResponseEntity<Object>> temporal(
            @RequestHeader(value = SESSION_HEADER, required = false) String session,
            @RequestParam(value = "sort", required = false) String sort) {
        Mono<TemporalAnalysis> result = analyticsService.temporal(session, sort);
        return respond(result, "temporal", session);
    }

    @GetMapping("/temporal/coverage")
    public Mono<ResponseEntity<Object>> coverage(
            @RequestHeader(value = SESSION_HEADER, required = false) String session,
            @RequestParam("initiative") String initiative,
            @RequestParam(value = "start", required = false) Integer start,
            @RequestParam(value = "end", required = false) Integer end) {
        log.info("Coverage query. initiative={} start={} end={}", initiative, start, end);
        Mono<CoverageDTO> result = analyticsService.coverage(session, initiative, start, end);
        return respond(result, "coverage", session);
    }

    @GetMapping("/groups")
    public Mono<ResponseEntity<Object>> groups(
            @RequestHeader(value = SESSION_HEADER, required = false) String session,
            @RequestParam(value = "by", required = false) String by,
            @RequestParam(value = "metric", required = false) String metric) {
        Mono<GroupAggregation> result = analyticsService.groups(session, by, metric);
        return respond(result, "groups", session);
    }

    @GetMapping("/classes")
    public Mono<ResponseEntity<Object>> classes(
            @RequestHeader(value = SESSION_HEADER, required = false) String session) {
        Mono<ClassAnalysis> result = analyticsService.classes(session);
        return respond(result, "classes", session);
    }

    @GetMapping("/rankings")
    public Mono<ResponseEntity<Object>> rankings(
            @RequestHeader(value = SESSION_HEADER, required = false) String session) {
        Mono<Rankings> result = analyticsService.rankings(session);
        return respond(result, "rankings", session);
    }

    @GetMapping("/calendar")
    public Mono<ResponseEntity<Object>> calendar(
            @RequestHeader(value = SESSION_HEADER, required = false) String session,
            @RequestParam(value = "crop", required = false) String crop) {
        Mono<CalendarAggregation> result = analyticsService.calendar(session, crop);
        return respond(result, "calendar", session);
    }

    @GetMapping("/calendar/validation")
    public Mono<ResponseEntity<Object>> calendarValidation(
            @RequestHeader(value = SESSION_HEADER, required = false) String session) {
        Mono<CalendarValidation> result = analyticsService.calendarValidation(session);
        return respond(result, "calendar-validation", session);
    }

    @GetMapping("/summary")
    public Mono<ResponseEntity<Object>> summary(
            @RequestHeader(value = SESSION_HEADER, required = false) String session) {
        Mono<AnalysisSummaryDTO> result = analyticsService.summary(session);
        return respond(result, "summary", session);
    }

    @PostMapping("/session/refresh")
    public Mono<ResponseEntity<Object>> refresh(
            @RequestHeader(value = SESSION_HEADER, required = false) String session) {
        Mono<AnalysisSummaryDTO> result = analyticsService.refresh(session);
        return respond(result, "refresh", session);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    // ── error mapping ────────────────────────────────────────────────────────

    private static Mono<ResponseEntity<Object>> respond(Mono<?> result, String endpoint, String session) {
        return result
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(toErrorResponse(e, endpoint, session)));
    }

    static ResponseEntity<Object> toErrorResponse(Throwable e, String endpoint, String session) {
        HttpStatus status;
        if (e instanceof InvalidYearWindowException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof UnknownInitiativeException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof DataLoadException) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
        } else {
            log.error("Analytics endpoint error. endpoint={} session={}", endpoint, session, e);
            return ResponseEntity.internalServerError()
                .body(new ErrorDTO("INTERNAL_ERROR", endpoint, e.getMessage()));
        }

        AnalyticsException failure = (AnalyticsException) e;
        log.warn("Analytics endpoint rejected. endpoint={} session={} status={} reason={}",
            endpoint, session, status.value(), failure.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorDTO(status.name(), failure.getSubject(), failure.getMessage()));
    }
}
