package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.model.graph.FileRelationships;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.ImpactAnalysisReport;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.support.GraphFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Traversal over a small import graph:
 *
 * <pre>
 * app/Main.java ──► service/OrderService.java ──► model/Order.java
 *      │              ▲          │                    │
 *      │         web/Api.java    ▼                    │
 *      └────────────────────► util/Money.java ◄───────┘
 * </pre>
 */
@DisplayName("Graph Traversal Service Tests")
class GraphTraversalServiceImplTest {

    private static final String MAIN = "app/Main.java";
    private static final String ORDER_SERVICE = "service/OrderService.java";
    private static final String ORDER = "model/Order.java";
    private static final String MONEY = "util/Money.java";
    private static final String API = "web/Api.java";

    private GraphTraversalServiceImpl traversal;
    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        traversal = new GraphTraversalServiceImpl();
        graph = GraphFixtures.graph(
            List.of(
                GraphFixtures.file(MAIN, 1),
                GraphFixtures.file(ORDER_SERVICE, 6),
                GraphFixtures.type(ORDER_SERVICE, "OrderService", 3, 1, null),
                GraphFixtures.function(ORDER_SERVICE, "OrderService.placeOrder", 10, 3, true),
                GraphFixtures.function(ORDER_SERVICE, "OrderService.audit", 20, 2, false),
                GraphFixtures.file(ORDER, 1),
                GraphFixtures.file(MONEY, 1),
                GraphFixtures.file(API, 1)),
            List.of(
                GraphFixtures.imports(MAIN, ORDER_SERVICE),
                GraphFixtures.imports(MAIN, MONEY),
                GraphFixtures.imports(ORDER_SERVICE, MONEY),
                GraphFixtures.imports(ORDER_SERVICE, ORDER),
                GraphFixtures.imports(ORDER, MONEY),
                GraphFixtures.imports(API, ORDER_SERVICE)));
    }

    @Test
    @DisplayName("Should list direct and transitive dependencies")
    void dependencies() {
        assertEquals(List.of(ORDER_SERVICE, MONEY), traversal.findDirectDependencies(graph, MAIN));
        assertEquals(List.of(ORDER, ORDER_SERVICE, MONEY), traversal.findAllDependencies(graph, MAIN, 5));
        assertTrue(traversal.findDirectDependencies(graph, MONEY).isEmpty());
    }

    @Test
    @DisplayName("Should list dependents within the depth limit")
    void dependents() {
        assertEquals(List.of(MAIN, ORDER, ORDER_SERVICE), traversal.findDirectDependents(graph, MONEY));
        assertEquals(List.of(MAIN, ORDER, ORDER_SERVICE), traversal.findAllDependents(graph, MONEY, 1));
        assertEquals(List.of(MAIN, ORDER, ORDER_SERVICE, API), traversal.findAllDependents(graph, MONEY, 5));
    }

    @Test
    @DisplayName("Unknown files have no neighbours")
    void unknownFile() {
        assertTrue(traversal.findDirectDependencies(graph, "missing/Nope.java").isEmpty());
        assertTrue(traversal.findAllDependents(graph, "missing/Nope.java", 5).isEmpty());
    }

    @Test
    @DisplayName("Should find the shortest import chain in import direction only")
    void shortestPath() {
        assertEquals(API + "->" + ORDER_SERVICE + "->" + MONEY, traversal.findShortestPath(graph, API, MONEY, 5));
        assertNull(traversal.findShortestPath(graph, MONEY, API, 5));
        assertNull(traversal.findShortestPath(graph, API, ORDER, 2));
    }

    @Test
    @DisplayName("Impact report splits dependents and weighs risk factors")
    void impact() {
        ImpactAnalysisReport report = traversal.analyzeImpact(graph, MONEY);

        assertTrue(report.isFound());
        assertEquals(List.of(MAIN, ORDER, ORDER_SERVICE), report.getDirectDependents());
        assertEquals(List.of(API), report.getIndirectDependents());
        assertTrue(report.getHubDependents().isEmpty());
        // 3 direct + 0.3 * 1 indirect falls in the 3-5 bucket
        assertEquals(40, report.getFactors().getDependencyScore());
        assertEquals(4, report.getFactors().getComplexityScore());
        assertEquals(0, report.getFactors().getChurnScore());
        assertEquals(21, report.getRiskScore());
        assertEquals(ImpactAnalysisReport.RiskLevel.LOW, report.getRiskLevel());
        assertEquals(List.of("Few files depend on it. Ripple effects are unlikely."), report.getRecommendations());
        assertThat(report.toMarkdown()).contains(
            "## Change impact: util/Money.java",
            "Risk: LOW (21/100)",
            "| Dependents | 40 | 3 direct, 1 indirect |",
            "1 more files reach it through other imports.");
    }

    @Test
    @DisplayName("Widely imported, complex and busy files are critical")
    void criticalImpact() {
        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();
        nodes.add(GraphFixtures.file("core/Core.java", 25)
            .withHistory(Instant.parse("2024-01-01T00:00:00Z"), 50, List.of("Ana", "Ben", "Cy", "Dee", "Eve")));
        nodes.add(GraphFixtures.file("core/Hub.java", 1));
        edges.add(GraphFixtures.imports("core/Hub.java", "core/Core.java"));
        for (int i = 0; i < 21; i++) {
            String client = "client/Client" + i + ".java";
            nodes.add(GraphFixtures.file(client, 1));
            edges.add(GraphFixtures.imports(client, "core/Hub.java"));
            edges.add(GraphFixtures.imports(client, "core/Core.java"));
        }
        KnowledgeGraph hubGraph = GraphFixtures.graph(nodes, edges);

        ImpactAnalysisReport report = traversal.analyzeImpact(hubGraph, "core/Core.java");

        assertEquals(22, report.getDirectDependents().size());
        assertTrue(report.getIndirectDependents().isEmpty());
        assertEquals(List.of("core/Hub.java"), report.getHubDependents());
        assertEquals(25, report.getMaxComplexity());
        assertEquals(100, report.getRiskScore());
        assertEquals(ImpactAnalysisReport.RiskLevel.CRITICAL, report.getRiskLevel());
        assertThat(report.getRecommendations()).contains(
            "Widely imported files depend on it: core/Hub.java.",
            "Pin current behavior with tests before editing.");
        assertThat(report.toMarkdown()).contains("- and 14 more");
    }

    @Test
    @DisplayName("A file missing from the graph gets an empty report")
    void impactOfUnknownFile() {
        ImpactAnalysisReport report = traversal.analyzeImpact(graph, "missing/Nope.java");

        assertFalse(report.isFound());
        assertEquals(0, report.getRiskScore());
        assertEquals(ImpactAnalysisReport.RiskLevel.LOW, report.getRiskLevel());
        assertThat(report.toMarkdown()).contains("Not in the knowledge graph");
    }

    @Test
    @DisplayName("Risk factor scales bucket their inputs")
    void riskFactorScales() {
        assertEquals(0, GraphTraversalServiceImpl.dependencyScore(0, 0));
        assertEquals(20, GraphTraversalServiceImpl.dependencyScore(2, 0));
        assertEquals(60, GraphTraversalServiceImpl.dependencyScore(4, 10));
        assertEquals(100, GraphTraversalServiceImpl.dependencyScore(21, 0));
        assertEquals(20, GraphTraversalServiceImpl.complexityScore(5));
        assertEquals(52, GraphTraversalServiceImpl.complexityScore(12));
        assertEquals(100, GraphTraversalServiceImpl.complexityScore(40));
        assertEquals(ImpactAnalysisReport.RiskLevel.MEDIUM, ImpactAnalysisReport.RiskLevel.of(25));
        assertEquals(ImpactAnalysisReport.RiskLevel.HIGH, ImpactAnalysisReport.RiskLevel.of(74));
    }

    @Test
    @DisplayName("Coupling combines direct imports with shared neighbours")
    void coupling() {
        // Main imports OrderService (0.3) and both import Money (0.05)
        assertEquals(0.35, traversal.calculateCouplingScore(graph, MAIN, ORDER_SERVICE), 1e-9);
        // Both import Money and are imported by nobody in common
        assertEquals(0.05, traversal.calculateCouplingScore(graph, MAIN, ORDER), 1e-9);
        assertEquals(0.0, traversal.calculateCouplingScore(graph, API, MONEY), 1e-9);
    }

    @Test
    @DisplayName("File relationships list imports, importers and exported symbols")
    void relationships() {
        FileRelationships relationships = traversal.getFileRelationships(graph, ORDER_SERVICE);

        assertTrue(relationships.isExists());
        assertThat(relationships.getImports()).extracting(FileRelationships.ImportLink::filePath)
            .containsExactly(MONEY, ORDER);
        assertEquals(List.of("Money"), relationships.getImports().get(0).symbols());
        assertThat(relationships.getImportedBy()).extracting(FileRelationships.ImportLink::filePath)
            .containsExactly(MAIN, API);
        assertThat(relationships.getExports()).extracting(FileRelationships.ExportedSymbol::name)
            .containsExactly("OrderService", "OrderService.placeOrder");
        assertEquals(0.2, relationships.getConnectivity(), 1e-9);
        assertEquals(String.join("\n",
            "**service/OrderService.java**",
            "Depends on 2 other files.",
            "Key dependencies: util/Money.java, model/Order.java",
            "2 files depend on it.",
            "Exports: OrderService, OrderService.placeOrder"), relationships.getSummary());
    }

    @Test
    @DisplayName("Leaf files get single-link wording")
    void leafSummary() {
        FileRelationships relationships = traversal.getFileRelationships(graph, API);

        assertEquals(String.join("\n",
            "**web/Api.java**",
            "Depends on 1 other file: service/OrderService.java",
            "Not imported by any scanned file."), relationships.getSummary());
        assertEquals(0.05, relationships.getConnectivity(), 1e-9);
    }

    @Test
    @DisplayName("Unknown files are reported as missing")
    void missingRelationships() {
        FileRelationships relationships = traversal.getFileRelationships(graph, "missing/Nope.java");

        assertFalse(relationships.isExists());
        assertTrue(relationships.getImports().isEmpty());
        assertEquals("File \"missing/Nope.java\" not found in the knowledge graph. Run a scan first.",
            relationships.getSummary());
    }
}
