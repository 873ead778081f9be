package com.lulcplatform.analytics.controller;

import com.lulcplatform.analytics.config.AnalyticsConfig;
import com.lulcplatform.analytics.loader.DataLocations;
import com.lulcplatform.analytics.loader.JsoncDataLoader;
import com.lulcplatform.analytics.service.ComparativeAnalyticsService;
import com.lulcplatform.analytics.session.AnalysisSessionCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;

class AnalyticsControllerTest {

    private WebTestClient client;

    private static WebTestClient clientFor(DataLocations locations) {
        JsoncDataLoader loader = new JsoncDataLoader(new AnalyticsConfig().objectMapper(), new DefaultResourceLoader());
        ComparativeAnalyticsService service =
            new ComparativeAnalyticsService(loader, locations, new AnalysisSessionCache(Duration.ofMinutes(30)));
        return WebTestClient.bindToController(new AnalyticsController(service)).build();
    }

    @BeforeEach
    void setUp() {
        client = clientFor(new DataLocations(
            "classpath:fixtures/initiatives.jsonc",
            "classpath:fixtures/metadata.jsonc",
            "classpath:fixtures/crop_calendar.jsonc"));
    }

    @Test
    @DisplayName("GET /comparison returns one row per initiative")
    void comparison() {
        client.get().uri("/api/v1/analytics/comparison")
            .header(AnalyticsController.SESSION_HEADER, "web")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.rows.length()").isEqualTo(3)
            .jsonPath("$.rows[0].name").isEqualTo("Alpha Map");
    }

    @Test
    @DisplayName("GET /temporal/coverage returns the window coverage")
    void coverage() {
        client.get().uri("/api/v1/analytics/temporal/coverage?initiative=Alpha Map&start=2015&end=2020")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.initiative").isEqualTo("Alpha Map")
            .jsonPath("$.startYear").isEqualTo(2015);
    }

    @Test
    @DisplayName("inverted window → 400")
    void invalidWindow() {
        client.get().uri("/api/v1/analytics/temporal/coverage?initiative=Alpha Map&start=2020&end=2015")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.subject").isEqualTo("coverage");
    }

    @Test
    @DisplayName("unknown initiative → 404")
    void unknownInitiative() {
        client.get().uri("/api/v1/analytics/temporal/coverage?initiative=Nobody&start=2015&end=2020")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("unreadable sources → 503")
    void unavailable() {
        clientFor(new DataLocations("classpath:fixtures/missing.jsonc", "classpath:fixtures/metadata.jsonc", ""))
            .get().uri("/api/v1/analytics/summary")
            .exchange()
            .expectStatus().isEqualTo(503);
    }

    @Test
    @DisplayName("POST /session/refresh returns a fresh summary")
    void refresh() {
        client.post().uri("/api/v1/analytics/session/refresh")
            .header(AnalyticsController.SESSION_HEADER, "web")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.sessionId").isEqualTo("web")
            .jsonPath("$.totalInitiatives").isEqualTo(3);
    }

    @Test
    @DisplayName("GET /calendar?crop= filters to one crop")
    void calendar() {
        client.get().uri("/api/v1/analytics/calendar?crop=Corn")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.crop").isEqualTo("Corn")
            .jsonPath("$.regions[0]").isEqualTo("South");
    }

    @Test
    @DisplayName("GET /health")
    void health() {
        client.get().uri("/api/v1/analytics/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
