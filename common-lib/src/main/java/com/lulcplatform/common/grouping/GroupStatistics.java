package com.lulcplatform.common.grouping;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One categorical group: every member, plus statistics of the chosen metric over
 * the members that report it ({@code reportingCount} of {@code count}).
 */
public record GroupStatistics(
    @JsonProperty("group")          String group,
    @JsonProperty("members")        List<String> members,
    @JsonProperty("count")          int count,
    @JsonProperty("reportingCount") int reportingCount,
    @JsonProperty("mean")           Double mean,
    @JsonProperty("std")            Double std,
    @JsonProperty("min")            Double min,
    @JsonProperty("max")            Double max
) {

    public GroupStatistics {
        members = List.copyOf(members);
    }

    static GroupStatistics of(String group, List<String> members, DescriptiveStats stats) {
        return new GroupStatistics(group, members, members.size(), stats.count(),
            stats.mean(), stats.std(), stats.min(), stats.max());
    }
}
