package com.purchasingpower.codegraph.service.graph.impl;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.ImmutableGraph;
import com.purchasingpower.codegraph.model.graph.EdgeKind;
import com.purchasingpower.codegraph.model.graph.FileNode;
import com.purchasingpower.codegraph.model.graph.FileRelationships;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.ImpactAnalysisReport;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.service.graph.GraphTraversalService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class GraphTraversalServiceImpl implements GraphTraversalService {

    private static final int IMPACT_DEPTH = 3;
    private static final int HUB_IMPORTERS = 3;
    private static final double DEPENDENCY_WEIGHT = 0.5;
    private static final double COMPLEXITY_WEIGHT = 0.3;
    private static final double CHURN_WEIGHT = 0.2;

    /** Import graphs of recently queried snapshots, keyed by identity. */
    private final Cache<KnowledgeGraph, ImmutableGraph<String>> importGraphs = CacheBuilder.newBuilder()
        .weakKeys()
        .maximumSize(8)
        .build();

    @Override
    public List<String> findDirectDependencies(KnowledgeGraph graph, String filePath) {
        ImmutableGraph<String> imports = importGraph(graph);
        return imports.nodes().contains(filePath) ? sorted(imports.successors(filePath)) : List.of();
    }

    @Override
    public List<String> findAllDependencies(KnowledgeGraph graph, String filePath, int maxDepth) {
        ImmutableGraph<String> imports = importGraph(graph);
        List<String> deps = traverse(filePath, maxDepth, node -> neighbours(imports, node, true));
        log.debug("Found {} dependencies for {} (depth {})", deps.size(), filePath, maxDepth);
        return deps;
    }

    @Override
    public List<String> findDirectDependents(KnowledgeGraph graph, String filePath) {
        ImmutableGraph<String> imports = importGraph(graph);
        return imports.nodes().contains(filePath) ? sorted(imports.predecessors(filePath)) : List.of();
    }

    @Override
    public List<String> findAllDependents(KnowledgeGraph graph, String filePath, int maxDepth) {
        ImmutableGraph<String> imports = importGraph(graph);
        List<String> dependents = traverse(filePath, maxDepth, node -> neighbours(imports, node, false));
        log.debug("Found {} dependents for {} (depth {})", dependents.size(), filePath, maxDepth);
        return dependents;
    }

    @Override
    public String findShortestPath(KnowledgeGraph graph, String startFile, String endFile, int maxDepth) {
        ImmutableGraph<String> imports = importGraph(graph);
        Queue<List<String>> queue = new LinkedList<>();
        Set<String> visited = new HashSet<>();

        queue.add(List.of(startFile));
        visited.add(startFile);

        while (!queue.isEmpty()) {
            List<String> path = queue.poll();
            String current = path.get(path.size() - 1);

            if (current.equals(endFile)) {
                log.debug("Found path: {}", path);
                return String.join("->", path);
            }

            if (path.size() >= maxDepth) continue;

            for (String neighbor : neighbours(imports, current, true)) {
                if (visited.add(neighbor)) {
                    List<String> newPath = new ArrayList<>(path);
                    newPath.add(neighbor);
                    queue.add(newPath);
                }
            }
        }

        return null;
    }

    @Override
    public ImpactAnalysisReport analyzeImpact(KnowledgeGraph graph, String filePath) {
        log.info("Analyzing impact for: {}", filePath);
        GraphNode file = graph.getNodes().get(filePath);
        if (!(file instanceof FileNode)) {
            return ImpactAnalysisReport.notFound(filePath);
        }

        List<String> directDependents = findDirectDependents(graph, filePath);
        List<String> indirectDependents = new ArrayList<>(findAllDependents(graph, filePath, IMPACT_DEPTH));
        indirectDependents.removeAll(directDependents);

        List<String> hubDependents = new ArrayList<>(directDependents);
        hubDependents.addAll(indirectDependents);
        hubDependents.removeIf(dependent -> findDirectDependents(graph, dependent).size() <= HUB_IMPORTERS);

        int maxComplexity = graph.nodesInFile(filePath).stream()
            .map(GraphNode::getComplexity)
            .filter(Objects::nonNull)
            .max(Integer::compare)
            .orElse(0);

        ImpactAnalysisReport.RiskFactors factors = ImpactAnalysisReport.RiskFactors.builder()
            .dependencyScore(dependencyScore(directDependents.size(), indirectDependents.size()))
            .complexityScore(complexityScore(maxComplexity))
            .churnScore(churnScore(file))
            .build();
        int riskScore = (int) Math.round(factors.getDependencyScore() * DEPENDENCY_WEIGHT
            + factors.getComplexityScore() * COMPLEXITY_WEIGHT
            + factors.getChurnScore() * CHURN_WEIGHT);
        ImpactAnalysisReport.RiskLevel riskLevel = ImpactAnalysisReport.RiskLevel.of(riskScore);

        return ImpactAnalysisReport.builder()
            .analyzedFile(filePath)
            .found(true)
            .directDependencies(findDirectDependencies(graph, filePath))
            .transitiveDependencies(findAllDependencies(graph, filePath, IMPACT_DEPTH))
            .directDependents(directDependents)
            .indirectDependents(indirectDependents)
            .hubDependents(hubDependents)
            .maxComplexity(maxComplexity)
            .factors(factors)
            .riskScore(riskScore)
            .riskLevel(riskLevel)
            .recommendations(recommend(directDependents, hubDependents, maxComplexity, riskLevel))
            .build();
    }

    @Override
    public FileRelationships getFileRelationships(KnowledgeGraph graph, String filePath) {
        if (!(graph.getNodes().get(filePath) instanceof FileNode)) {
            return FileRelationships.builder()
                .filePath(filePath)
                .exists(false)
                .imports(List.of())
                .importedBy(List.of())
                .exports(List.of())
                .connectivity(0)
                .summary("File \"" + filePath + "\" not found in the knowledge graph. Run a scan first.")
                .build();
        }

        List<FileRelationships.ImportLink> imports = new ArrayList<>();
        List<FileRelationships.ImportLink> importedBy = new ArrayList<>();
        List<FileRelationships.ExportedSymbol> exports = new ArrayList<>();
        for (GraphEdge edge : graph.getEdges()) {
            if (edge.getType() == EdgeKind.IMPORTS && edge.getSource().equals(filePath)) {
                imports.add(new FileRelationships.ImportLink(edge.getTarget(), symbolsOf(edge)));
            } else if (edge.getType() == EdgeKind.IMPORTS && edge.getTarget().equals(filePath)) {
                importedBy.add(new FileRelationships.ImportLink(edge.getSource(), symbolsOf(edge)));
            } else if (edge.getType() == EdgeKind.CONTAINS && edge.getSource().equals(filePath)) {
                GraphNode symbol = graph.getNodes().get(edge.getTarget());
                if (symbol != null && symbol.isExported()) {
                    exports.add(new FileRelationships.ExportedSymbol(symbol.getName(), symbol.getKind(), symbol.getLineStart()));
                }
            }
        }

        double connectivity = Math.round(Math.min(1, (imports.size() + importedBy.size()) / 20.0) * 100) / 100.0;
        return FileRelationships.builder()
            .filePath(filePath)
            .exists(true)
            .imports(imports)
            .importedBy(importedBy)
            .exports(exports)
            .connectivity(connectivity)
            .summary(summarize(filePath, imports, importedBy, exports, connectivity))
            .build();
    }

    @Override
    public double calculateCouplingScore(KnowledgeGraph graph, String fileA, String fileB) {
        ImmutableGraph<String> imports = importGraph(graph);
        double score = 0;

        if (imports.hasEdgeConnecting(fileA, fileB)) score += 0.3;
        if (imports.hasEdgeConnecting(fileB, fileA)) score += 0.3;

        Set<String> sharedDeps = new HashSet<>(neighbours(imports, fileA, true));
        sharedDeps.retainAll(neighbours(imports, fileB, true));
        score += Math.min(0.2, sharedDeps.size() * 0.05);

        Set<String> sharedImporters = new HashSet<>(neighbours(imports, fileA, false));
        sharedImporters.retainAll(neighbours(imports, fileB, false));
        score += Math.min(0.2, sharedImporters.size() * 0.05);

        return Math.min(1, score);
    }

    private ImmutableGraph<String> importGraph(KnowledgeGraph graph) {
        try {
            return importGraphs.get(graph, () -> buildImportGraph(graph));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to index import graph", e.getCause());
        }
    }

    private static ImmutableGraph<String> buildImportGraph(KnowledgeGraph graph) {
        ImmutableGraph.Builder<String> builder = GraphBuilder.directed()
            .allowsSelfLoops(false)
            .<String>immutable();
        graph.nodesOfType(FileNode.class).forEach(file -> builder.addNode(file.getId()));
        for (GraphEdge edge : graph.getEdges()) {
            if (edge.getType() == EdgeKind.IMPORTS && !edge.getSource().equals(edge.getTarget())) {
                builder.putEdge(edge.getSource(), edge.getTarget());
            }
        }
        return builder.build();
    }

    private static Set<String> neighbours(ImmutableGraph<String> imports, String node, boolean outgoing) {
        if (!imports.nodes().contains(node)) {
            return Set.of();
        }
        return outgoing ? imports.successors(node) : imports.predecessors(node);
    }

    private static List<String> traverse(String startNode, int maxDepth, Function<String, Set<String>> next) {
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new LinkedList<>();
        Map<String, Integer> depths = new HashMap<>();

        queue.add(startNode);
        depths.put(startNode, 0);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int currentDepth = depths.get(current);

            if (currentDepth >= maxDepth) continue;

            for (String neighbor : next.apply(current)) {
                if (visited.add(neighbor)) {
                    queue.add(neighbor);
                    depths.put(neighbor, currentDepth + 1);
                }
            }
        }

        visited.remove(startNode);
        return sorted(visited);
    }

    @SuppressWarnings("unchecked")
    private static List<String> symbolsOf(GraphEdge edge) {
        Object symbols = edge.getMetadata() != null ? edge.getMetadata().get(GraphEdge.SYMBOLS) : null;
        return symbols instanceof List<?> list ? (List<String>) list : List.of();
    }

    private static String summarize(String filePath, List<FileRelationships.ImportLink> imports,
                                    List<FileRelationships.ImportLink> importedBy,
                                    List<FileRelationships.ExportedSymbol> exports, double connectivity) {
        List<String> parts = new ArrayList<>();
        parts.add("**" + filePath + "**");

        if (imports.isEmpty()) {
            parts.add("No dependencies on other scanned files.");
        } else if (imports.size() == 1) {
            parts.add("Depends on 1 other file: " + imports.get(0).filePath());
        } else {
            parts.add("Depends on " + imports.size() + " other files.");
            parts.add("Key dependencies: " + imports.stream().limit(3)
                .map(FileRelationships.ImportLink::filePath).collect(Collectors.joining(", ")));
        }

        if (importedBy.isEmpty()) {
            parts.add("Not imported by any scanned file.");
        } else if (importedBy.size() == 1) {
            parts.add("1 file depends on it: " + importedBy.get(0).filePath());
        } else {
            parts.add(importedBy.size() + " files depend on it.");
            if (importedBy.size() > 5) {
                parts.add("Widely used.");
            }
        }

        if (!exports.isEmpty()) {
            String names = exports.stream().limit(5)
                .map(FileRelationships.ExportedSymbol::name).collect(Collectors.joining(", "));
            parts.add("Exports: " + names + (exports.size() > 5 ? " and " + (exports.size() - 5) + " more" : ""));
        }

        if (connectivity > 0.7) {
            parts.add("⚠️ High coupling - changes here may have wide impact.");
        } else if (connectivity > 0.4) {
            parts.add("Moderate coupling - be mindful of dependencies.");
        }
        return String.join("\n", parts);
    }

    private static List<String> sorted(Set<String> nodes) {
        return new ArrayList<>(new TreeSet<>(nodes));
    }

    /** Buckets of {@code direct + 0.3 * indirect}. */
    static int dependencyScore(int direct, int indirect) {
        double reach = direct + indirect * 0.3;
        if (reach == 0) return 0;
        if (reach <= 2) return 20;
        if (reach <= 5) return 40;
        if (reach <= 10) return 60;
        if (reach <= 20) return 80;
        return 100;
    }

    static int complexityScore(int complexity) {
        if (complexity <= 5) return complexity * 4;
        if (complexity <= 10) return 20 + (complexity - 5) * 4;
        if (complexity <= 15) return 40 + (complexity - 10) * 6;
        return Math.min(100, 70 + (complexity - 15) * 3);
    }

    /** Half for commits (saturating at 50), half for contributors (saturating at 5). */
    static int churnScore(GraphNode file) {
        int commits = file.getModificationCount() != null ? file.getModificationCount() : 0;
        int contributors = file.getContributors() != null ? file.getContributors().size() : 0;
        return (int) Math.round(Math.min(1.0, commits / 50.0) * 50 + Math.min(1.0, contributors / 5.0) * 50);
    }

    private static List<String> recommend(List<String> directDependents, List<String> hubDependents,
                                          int maxComplexity, ImpactAnalysisReport.RiskLevel riskLevel) {
        List<String> advice = new ArrayList<>();
        if (directDependents.size() > 10) {
            advice.add(directDependents.size() + " files import this one directly. Splitting it would narrow what each change reaches.");
        }
        if (!hubDependents.isEmpty()) {
            advice.add("Widely imported files depend on it: "
                + hubDependents.stream().limit(3).collect(Collectors.joining(", ")) + ".");
        }
        if (maxComplexity > 15) {
            advice.add("Its most complex symbol scores " + maxComplexity + ". Simplify that first.");
        }
        if (riskLevel == ImpactAnalysisReport.RiskLevel.HIGH || riskLevel == ImpactAnalysisReport.RiskLevel.CRITICAL) {
            advice.add("Pin current behavior with tests before editing.");
            advice.add("Land the change in small commits.");
        }
        if (directDependents.size() > 5) {
            advice.add("Run the tests of " + directDependents.stream().limit(3).collect(Collectors.joining(", ")) + " first.");
        }
        if (advice.isEmpty()) {
            advice.add("Few files depend on it. Ripple effects are unlikely.");
        }
        return advice;
    }
}
