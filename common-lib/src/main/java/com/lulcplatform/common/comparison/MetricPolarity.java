package com.lulcplatform.common.comparison;

/**
 * Direction in which a tracked metric improves.
 */
public enum MetricPolarity {

    /** Larger raw values are better (accuracy, class count). */
    HIGHER_IS_BETTER,

    /** Smaller raw values are better (spatial resolution in metres). */
    LOWER_IS_BETTER
}
