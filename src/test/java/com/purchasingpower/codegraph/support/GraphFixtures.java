package com.purchasingpower.codegraph.support;

import com.purchasingpower.codegraph.model.graph.ClassNode;
import com.purchasingpower.codegraph.model.graph.EdgeKind;
import com.purchasingpower.codegraph.model.graph.FileNode;
import com.purchasingpower.codegraph.model.graph.FunctionNode;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphMetadata;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.model.graph.NodeKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-built graph snapshots for tests that do not need a real scan.
 */
public final class GraphFixtures {

    public static final String ROOT = "/repo";

    private GraphFixtures() {
    }

    public static FileNode file(String path, int complexity) {
        return FileNode.builder()
            .id(path)
            .name(path.substring(path.lastIndexOf('/') + 1))
            .filePath(path)
            .lineStart(1)
            .lineEnd(100)
            .exported(true)
            .complexity(complexity)
            .language("java")
            .lineCount(100)
            .build();
    }

    public static FunctionNode function(String path, String name, int line, int complexity, boolean exported) {
        return FunctionNode.builder()
            .id(GraphNode.symbolId(path, NodeKind.FUNCTION, name, line))
            .name(name)
            .filePath(path)
            .lineStart(line)
            .lineEnd(line + 5)
            .exported(exported)
            .complexity(complexity)
            .returnType("void")
            .build();
    }

    public static ClassNode type(String path, String name, int line, int complexity, String documentation) {
        return ClassNode.builder()
            .id(GraphNode.symbolId(path, NodeKind.CLASS, name, line))
            .name(name)
            .filePath(path)
            .lineStart(line)
            .lineEnd(line + 40)
            .exported(true)
            .complexity(complexity)
            .documentation(documentation)
            .build();
    }

    public static GraphEdge imports(String from, String to) {
        return GraphEdge.builder()
            .id("import-" + from + "-" + to)
            .source(from)
            .target(to)
            .type(EdgeKind.IMPORTS)
            .metadata(Map.of(GraphEdge.SYMBOLS, List.of(simpleName(to)), GraphEdge.IS_STATIC, false,
                GraphEdge.IS_WILDCARD, false))
            .build();
    }

    /**
     * Snapshot of the given nodes with a contains edge from each file to its symbols.
     */
    public static KnowledgeGraph graph(List<GraphNode> nodes, List<GraphEdge> imports) {
        Map<String, GraphNode> byId = new LinkedHashMap<>();
        nodes.forEach(node -> byId.put(node.getId(), node));
        List<GraphEdge> edges = new ArrayList<>();
        for (GraphNode node : nodes) {
            if (node.getKind() != NodeKind.FILE) {
                edges.add(GraphEdge.builder()
                    .id("contains-" + edges.size())
                    .source(node.getFilePath())
                    .target(node.getId())
                    .type(EdgeKind.CONTAINS)
                    .build());
            }
        }
        edges.addAll(imports);
        GraphMetadata metadata = GraphMetadata.builder()
            .scannedAt(Instant.parse("2024-01-01T00:00:00Z"))
            .rootDir(ROOT)
            .fileCount((int) nodes.stream().filter(node -> node.getKind() == NodeKind.FILE).count())
            .languages(Map.of("java", 1))
            .nodeCount(byId.size())
            .edgeCount(edges.size())
            .build();
        return KnowledgeGraph.snapshot(metadata, byId, edges);
    }

    private static String simpleName(String path) {
        String file = path.substring(path.lastIndexOf('/') + 1);
        return file.endsWith(".java") ? file.substring(0, file.length() - 5) : file;
    }
}
