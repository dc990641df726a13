package com.purchasingpower.codegraph.model.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of a scanned repository: nodes keyed by id, an ordered
 * edge list and the scan metadata. A rescan replaces the whole snapshot.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class KnowledgeGraph {

    public static final String CURRENT_VERSION = "1.0.0";

    String version;
    GraphMetadata metadata;
    Map<String, GraphNode> nodes;
    List<GraphEdge> edges;

    /**
     * Creates a snapshot whose collections can no longer be modified.
     */
    public static KnowledgeGraph snapshot(GraphMetadata metadata, Map<String, GraphNode> nodes, List<GraphEdge> edges) {
        return KnowledgeGraph.builder()
            .version(CURRENT_VERSION)
            .metadata(metadata)
            .nodes(Collections.unmodifiableMap(new LinkedHashMap<>(nodes)))
            .edges(List.copyOf(edges))
            .build();
    }

    public Optional<GraphNode> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public List<GraphEdge> edgesOfType(EdgeKind kind) {
        return edges.stream()
            .filter(edge -> edge.getType() == kind)
            .collect(Collectors.toList());
    }

    public List<GraphNode> nodesInFile(String filePath) {
        return nodes.values().stream()
            .filter(node -> filePath.equals(node.getFilePath()))
            .collect(Collectors.toList());
    }

    public <T extends GraphNode> List<T> nodesOfType(Class<T> type) {
        return nodes.values().stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    /**
     * Files that import the given file, sorted.
     */
    public Set<String> dependentsOf(String filePath) {
        return edges.stream()
            .filter(edge -> edge.getType() == EdgeKind.IMPORTS && edge.getTarget().equals(filePath))
            .map(GraphEdge::getSource)
            .collect(Collectors.toCollection(TreeSet::new));
    }
}
