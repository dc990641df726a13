package com.purchasingpower.codegraph.analysis;

import com.purchasingpower.codegraph.model.graph.EdgeKind;
import com.purchasingpower.codegraph.model.graph.GraphMetadata;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Node and edge counts of a snapshot by kind, plus complexity of the scored symbols.
 */
@Value
@Builder
public class GraphStatistics {

    GraphMetadata metadata;
    int nodeCount;
    int edgeCount;
    Map<NodeKind, Integer> nodesByKind;
    Map<EdgeKind, Integer> edgesByKind;
    double averageComplexity;
    int maxComplexity;

    public static GraphStatistics of(KnowledgeGraph graph) {
        Map<NodeKind, Integer> nodesByKind = new EnumMap<>(NodeKind.class);
        graph.getNodes().values().forEach(node -> nodesByKind.merge(node.getKind(), 1, Integer::sum));

        Map<EdgeKind, Integer> edgesByKind = new EnumMap<>(EdgeKind.class);
        graph.getEdges().forEach(edge -> edgesByKind.merge(edge.getType(), 1, Integer::sum));

        int[] scores = graph.getNodes().values().stream()
            .filter(node -> node.getKind() != NodeKind.FILE)
            .map(GraphNode::getComplexity)
            .filter(Objects::nonNull)
            .mapToInt(Integer::intValue)
            .toArray();
        double average = 0;
        int max = 0;
        if (scores.length > 0) {
            long total = 0;
            for (int score : scores) {
                total += score;
                max = Math.max(max, score);
            }
            average = Math.round((double) total / scores.length * 100) / 100.0;
        }

        return GraphStatistics.builder()
            .metadata(graph.getMetadata())
            .nodeCount(graph.getNodes().size())
            .edgeCount(graph.getEdges().size())
            .nodesByKind(nodesByKind)
            .edgesByKind(edgesByKind)
            .averageComplexity(average)
            .maxComplexity(max)
            .build();
    }
}
