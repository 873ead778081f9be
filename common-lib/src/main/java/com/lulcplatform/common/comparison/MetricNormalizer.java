package com.lulcplatform.common.comparison;

import java.util.Collection;
import java.util.Objects;

/**
 * Min-max scaling of a metric to [0.0, 1.0] honouring its {@link MetricPolarity}.
 *
 * <pre>
 *   HIGHER_IS_BETTER:  (v - min) / (max - min)
 *   LOWER_IS_BETTER:   1 - (v - min) / (max - min)
 *   max == min:        1.0 for every reporting initiative
 * </pre>
 *
 * <p>Missing values never take part: they are excluded from the range and get no score.
 */
public final class MetricNormalizer {

    private MetricNormalizer() {}

    /**
     * @param values raw values; {@code null} entries are ignored
     * @return the range over non-null values, or {@code null} when none is present
     */
    public static MetricRange range(Collection<Double> values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int count = 0;
        for (Double value : values) {
            if (value == null) continue;
            min = Math.min(min, value);
            max = Math.max(max, value);
            count++;
        }
        return count == 0 ? null : new MetricRange(min, max, count);
    }

    public static double normalize(double value, MetricRange range, MetricPolarity polarity) {
        Objects.requireNonNull(range, "range");
        if (range.isDegenerate()) {
            return 1.0;
        }
        double scaled = (value - range.min()) / (range.max() - range.min());
        scaled = Math.max(0.0, Math.min(1.0, scaled));
        return polarity == MetricPolarity.LOWER_IS_BETTER ? 1.0 - scaled : scaled;
    }
}
