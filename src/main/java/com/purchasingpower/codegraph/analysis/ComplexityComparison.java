package com.purchasingpower.codegraph.analysis;

import java.util.List;

/**
 * Nodes present in both snapshots, split by how their complexity moved.
 * Hotspots carry the newer score.
 */
public record ComplexityComparison(List<ComplexityHotspot> improved, List<ComplexityHotspot> worsened, int unchanged) {
}
