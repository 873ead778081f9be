package com.lulcplatform.common.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Global period spanned by the union of all initiatives' years.
 */
public record CoveragePeriod(
    @JsonProperty("startYear") int startYear,
    @JsonProperty("endYear")   int endYear
) {

    @JsonProperty("span")
    public int span() {
        return endYear - startYear + 1;
    }
}
