package com.purchasingpower.codegraph.embedding;

import com.purchasingpower.codegraph.model.graph.ClassNode;
import com.purchasingpower.codegraph.model.graph.EnumNode;
import com.purchasingpower.codegraph.model.graph.FunctionNode;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.InterfaceNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.model.graph.TypeAliasNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Synthesizes the text document indexed for each graph node: name, kind,
 * path segments, documentation, signature details and the names of directly
 * related nodes.
 */
public class ChunkContentBuilder {

    private final KnowledgeGraph graph;
    private final int relatedNodeLimit;
    private final Map<String, List<GraphEdge>> edgesByNode = new HashMap<>();

    public ChunkContentBuilder(KnowledgeGraph graph, int relatedNodeLimit) {
        this.graph = graph;
        this.relatedNodeLimit = relatedNodeLimit;
        for (GraphEdge edge : graph.getEdges()) {
            edgesByNode.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge);
            if (!edge.getTarget().equals(edge.getSource())) {
                edgesByNode.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge);
            }
        }
    }

    public String build(GraphNode node) {
        List<String> parts = new ArrayList<>();
        parts.add(node.getName());
        parts.add(node.getKind().getValue());
        parts.add(String.join(" ", node.getFilePath().split("/")));
        if (node.getDocumentation() != null) {
            parts.add(node.getDocumentation());
        }

        if (node instanceof FunctionNode function) {
            parts.addAll(function.getParameters());
            if (function.getReturnType() != null) {
                parts.add(function.getReturnType());
            }
            if (function.isAsync()) {
                parts.add("async");
            }
        } else if (node instanceof ClassNode type) {
            if (type.getSuperclass() != null) {
                parts.add("extends " + type.getSuperclass());
            }
            if (!type.getInterfaces().isEmpty()) {
                parts.add("implements " + String.join(" ", type.getInterfaces()));
            }
        } else if (node instanceof InterfaceNode type && !type.getSuperInterfaces().isEmpty()) {
            parts.add("extends " + String.join(" ", type.getSuperInterfaces()));
        } else if (node instanceof EnumNode type) {
            parts.addAll(type.getConstants());
        } else if (node instanceof TypeAliasNode type) {
            if (type.getForm() != null) {
                parts.add(type.getForm());
            }
            parts.addAll(type.getComponents());
        }

        Set<String> related = relatedNames(node);
        if (!related.isEmpty()) {
            parts.add(String.join(" ", related));
        }
        return String.join(" ", parts);
    }

    private Set<String> relatedNames(GraphNode node) {
        Set<String> names = new LinkedHashSet<>();
        for (GraphEdge edge : edgesByNode.getOrDefault(node.getId(), List.of())) {
            if (names.size() >= relatedNodeLimit) {
                break;
            }
            String otherId = edge.getSource().equals(node.getId()) ? edge.getTarget() : edge.getSource();
            graph.findNode(otherId).ifPresent(other -> names.add(other.getName()));
        }
        return names;
    }
}
