package com.lulcplatform.analytics.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Top level of the crop calendar file. Only {@code crop_calendar} is analysed;
 * the descriptive header fields are kept for the summary endpoint.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CropCalendarDocument {

    @JsonProperty("initiative_name")
    private String initiativeName;

    @JsonProperty("source")
    private String source;

    @JsonProperty("crop_calendar")
    private Map<String, Object> cropCalendar;
}
