package com.lulcplatform.common.grouping;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public record GroupAggregation(
    @JsonProperty("groupColumn")  String groupColumn,
    @JsonProperty("metricColumn") String metricColumn,
    @JsonProperty("groups")       Map<String, GroupStatistics> groups
) {

    public GroupAggregation {
        groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    }

    public Optional<GroupStatistics> group(String key) {
        return Optional.ofNullable(groups.get(key));
    }
}
