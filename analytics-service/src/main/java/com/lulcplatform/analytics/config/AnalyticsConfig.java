package com.lulcplatform.analytics.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lulcplatform.analytics.loader.DataLocations;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AnalyticsConfig {

    @Value("${analytics.data.initiatives}")
    private String initiativesLocation;

    @Value("${analytics.data.metadata}")
    private String metadataLocation;

    @Value("${analytics.data.calendar:}")
    private String calendarLocation;

    @Value("${analytics.session.ttl:PT30M}")
    private Duration sessionTtl;

    @Bean
    public DataLocations dataLocations() {
        return new DataLocations(initiativesLocation, metadataLocation, calendarLocation);
    }

    @Bean
    public Duration sessionTtl() {
        return sessionTtl;
    }

    /**
     * Shared mapper for the REST layer and the source loader. Source files are
     * commented JSON, so comments and trailing commas are accepted on read.
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
        mapper.configure(JsonParser.Feature.ALLOW_TRAILING_COMMA, true);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
