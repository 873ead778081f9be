package com.lulcplatform.common.grouping;

import com.lulcplatform.common.model.Initiative;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups initiatives by legend size and relates class count to accuracy.
 */
public final class ClassAnalyzer {

    static final String LOW    = "Low (2-10)";
    static final String MEDIUM = "Medium (11-20)";
    static final String HIGH   = "High (21+)";

    private ClassAnalyzer() {}

    public static ClassAnalysis analyze(List<Initiative> initiatives) {
        List<Initiative> reporting = initiatives.stream()
            .filter(i -> i.numClasses() != null)
            .toList();

        Map<Integer, Integer> distribution = new TreeMap<>();
        for (Initiative initiative : reporting) {
            distribution.merge(initiative.numClasses(), 1, Integer::sum);
        }

        List<ClassBucket> buckets = List.of(
            bucket(LOW, 2, 10, reporting),
            bucket(MEDIUM, 11, 20, reporting),
            bucket(HIGH, 21, null, reporting)
        );

        List<double[]> pairs = new ArrayList<>();
        for (Initiative initiative : reporting) {
            if (initiative.accuracyPct() != null) {
                pairs.add(new double[] { initiative.numClasses(), initiative.accuracyPct() });
            }
        }

        DescriptiveStats classStats = DescriptiveStats.of(
            reporting.stream().map(i -> i.numClasses().doubleValue()).toList());

        return new ClassAnalysis(classStats, distribution, buckets, pearson(pairs), pairs.size());
    }

    /**
     * Pearson correlation coefficient of (x, y) pairs; null when undefined.
     */
    static Double pearson(List<double[]> pairs) {
        int n = pairs.size();
        if (n < 2) return null;

        double sumX = 0, sumY = 0;
        for (double[] p : pairs) {
            sumX += p[0];
            sumY += p[1];
        }
        double meanX = sumX / n;
        double meanY = sumY / n;

        double cov = 0, varX = 0, varY = 0;
        for (double[] p : pairs) {
            double dx = p[0] - meanX;
            double dy = p[1] - meanY;
            cov += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0 || varY == 0) return null;
        return cov / Math.sqrt(varX * varY);
    }

    private static ClassBucket bucket(String label, int min, Integer max, List<Initiative> reporting) {
        ClassBucket empty = new ClassBucket(label, min, max, List.of(), List.of());
        List<String> members = new ArrayList<>();
        List<Integer> values = new ArrayList<>();
        for (Initiative initiative : reporting) {
            if (empty.accepts(initiative.numClasses())) {
                members.add(initiative.name());
                values.add(initiative.numClasses());
            }
        }
        return new ClassBucket(label, min, max, members, values);
    }
}
