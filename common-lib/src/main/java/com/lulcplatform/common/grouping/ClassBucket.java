package com.lulcplatform.common.grouping;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Initiatives whose legend has between {@code minClasses} and {@code maxClasses}
 * classes (inclusive; {@code maxClasses} null means unbounded).
 */
public record ClassBucket(
    @JsonProperty("label")       String label,
    @JsonProperty("minClasses")  int minClasses,
    @JsonProperty("maxClasses")  Integer maxClasses,
    @JsonProperty("members")     List<String> members,
    @JsonProperty("classValues") List<Integer> classValues
) {

    public ClassBucket {
        members = List.copyOf(members);
        classValues = List.copyOf(classValues);
    }

    public int count() {
        return members.size();
    }

    boolean accepts(int classes) {
        return classes >= minClasses && (maxClasses == null || classes <= maxClasses);
    }
}
