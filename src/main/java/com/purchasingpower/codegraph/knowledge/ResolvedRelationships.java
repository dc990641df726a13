package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.graph.GraphEdge;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolver output: edges in emission order, each file's dependencies and the inverse map.
 */
@Value
public class ResolvedRelationships {

    List<GraphEdge> edges;
    Map<String, Set<String>> dependencies;
    Map<String, Set<String>> dependents;

    public int dependencyCount(String filePath) {
        return dependencies.getOrDefault(filePath, Set.of()).size();
    }

    public int dependentCount(String filePath) {
        return dependents.getOrDefault(filePath, Set.of()).size();
    }
}
