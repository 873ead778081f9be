package com.lulcplatform.common.grouping;

import com.lulcplatform.common.model.Initiative;
import com.lulcplatform.common.model.InitiativeColumns;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions initiatives by a categorical column and summarizes a numeric metric
 * per group.
 *
 * <p>Initiatives with a missing categorical value go to {@value #UNKNOWN_GROUP}.
 * Groups appear in first-seen order. Statistics use only members that report
 * the metric; a group where nobody does gets null statistics, never zeros.
 * Standard deviation uses the population formula.
 */
public final class GroupAggregator {

    public static final String UNKNOWN_GROUP = "Unknown";

    private GroupAggregator() {}

    public static GroupAggregation aggregate(List<Initiative> initiatives,
                                             String groupColumn,
                                             String metricColumn) {
        Map<String, List<Initiative>> partitions = new LinkedHashMap<>();
        for (Initiative initiative : initiatives) {
            String key = initiative.categoricalValue(groupColumn);
            partitions.computeIfAbsent(key == null ? UNKNOWN_GROUP : key, k -> new ArrayList<>())
                .add(initiative);
        }

        Map<String, GroupStatistics> groups = new LinkedHashMap<>();
        partitions.forEach((key, members) -> {
            List<String> names = members.stream().map(Initiative::name).toList();
            List<Double> values = members.stream().map(i -> i.numericValue(metricColumn)).toList();
            groups.put(key, GroupStatistics.of(key, names, DescriptiveStats.of(values)));
        });
        return new GroupAggregation(groupColumn, metricColumn, groups);
    }

    public static GroupAggregation byMethodology(List<Initiative> initiatives, String metricColumn) {
        return aggregate(initiatives, InitiativeColumns.METHODOLOGY, metricColumn);
    }

    public static GroupAggregation byScope(List<Initiative> initiatives, String metricColumn) {
        return aggregate(initiatives, InitiativeColumns.SCOPE, metricColumn);
    }
}
