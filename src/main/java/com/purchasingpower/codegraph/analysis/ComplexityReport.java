package com.purchasingpower.codegraph.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Complexity summary over all non-file nodes that carry a score.
 * {@code averageComplexity} is rounded to two decimals.
 */
@Value
@Builder
public class ComplexityReport {

    double averageComplexity;
    int maxComplexity;
    long totalComplexity;
    List<ComplexityHotspot> hotspots;
    Map<ComplexityCategory, Integer> distribution;
}
