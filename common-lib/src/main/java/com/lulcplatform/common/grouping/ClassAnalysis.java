package com.lulcplatform.common.grouping;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Legend-size profile of the initiative table.
 *
 * <ul>
 *   <li>{@code classStats}          – statistics of {@code num_classes} over reporting initiatives.</li>
 *   <li>{@code distribution}        – class count → number of initiatives, ascending.</li>
 *   <li>{@code buckets}             – Low / Medium / High legend-size buckets.</li>
 *   <li>{@code accuracyCorrelation} – Pearson r between class count and accuracy; null with
 *       fewer than two initiatives reporting both, or when either has no variance.</li>
 * </ul>
 */
public record ClassAnalysis(
    @JsonProperty("classStats")            DescriptiveStats classStats,
    @JsonProperty("distribution")          Map<Integer, Integer> distribution,
    @JsonProperty("buckets")               List<ClassBucket> buckets,
    @JsonProperty("accuracyCorrelation")   Double accuracyCorrelation,
    @JsonProperty("correlationSampleSize") int correlationSampleSize
) {

    public ClassAnalysis {
        distribution = Collections.unmodifiableMap(new TreeMap<>(distribution));
        buckets = List.copyOf(buckets);
    }
}
