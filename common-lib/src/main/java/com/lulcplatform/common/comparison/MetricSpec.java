package com.lulcplatform.common.comparison;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lulcplatform.common.model.InitiativeColumns;

import java.util.List;

/**
 * A numeric initiative column tracked by the comparison matrix, with its polarity.
 */
public record MetricSpec(
    @JsonProperty("column")   String column,
    @JsonProperty("polarity") MetricPolarity polarity
) {

    public static MetricSpec higherIsBetter(String column) {
        return new MetricSpec(column, MetricPolarity.HIGHER_IS_BETTER);
    }

    public static MetricSpec lowerIsBetter(String column) {
        return new MetricSpec(column, MetricPolarity.LOWER_IS_BETTER);
    }

    /** Accuracy (higher), resolution (lower), class count (higher). */
    public static List<MetricSpec> defaults() {
        return List.of(
            higherIsBetter(InitiativeColumns.ACCURACY_PCT),
            lowerIsBetter(InitiativeColumns.RESOLUTION_M),
            higherIsBetter(InitiativeColumns.NUM_CLASSES)
        );
    }
}
