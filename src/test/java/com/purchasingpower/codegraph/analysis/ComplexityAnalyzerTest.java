package com.purchasingpower.codegraph.analysis;

import com.purchasingpower.codegraph.model.graph.ClassNode;
import com.purchasingpower.codegraph.model.graph.EdgeKind;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.support.GraphFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Complexity Analyzer Tests")
class ComplexityAnalyzerTest {

    private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();

    @Test
    @DisplayName("Hotspots skip files unless asked and sort by complexity")
    void hotspots() {
        KnowledgeGraph graph = billingGraph(25, 12);

        assertThat(analyzer.findHotspots(graph)).extracting(ComplexityHotspot::getName)
            .containsExactly("Billing.charge", "Billing.refund");
        assertThat(analyzer.findHotspots(graph, 10, 10, true)).extracting(ComplexityHotspot::getName)
            .containsExactly("Billing.java", "Billing.charge", "Billing.refund");
        assertThat(analyzer.findHotspots(graph, 1, 1, false)).extracting(ComplexityHotspot::getName)
            .containsExactly("Billing.charge");
        assertEquals(ComplexityCategory.VERY_HIGH, analyzer.findHotspots(graph).get(0).getCategory());
    }

    @Test
    @DisplayName("Report aggregates symbol scores into a distribution")
    void report() {
        ComplexityReport report = analyzer.generateReport(billingGraph(25, 12));

        assertEquals(49, report.getTotalComplexity());
        assertEquals(9.8, report.getAverageComplexity(), 1e-9);
        assertEquals(25, report.getMaxComplexity());
        assertEquals(2, report.getDistribution().get(ComplexityCategory.LOW));
        assertEquals(1, report.getDistribution().get(ComplexityCategory.MEDIUM));
        assertEquals(1, report.getDistribution().get(ComplexityCategory.HIGH));
        assertEquals(1, report.getDistribution().get(ComplexityCategory.VERY_HIGH));
        assertThat(report.getHotspots()).hasSize(2);
    }

    @Test
    @DisplayName("An empty graph yields a zeroed report")
    void emptyReport() {
        ComplexityReport report = analyzer.generateReport(GraphFixtures.graph(List.of(), List.of()));

        assertEquals(0, report.getTotalComplexity());
        assertEquals(0.0, report.getAverageComplexity());
        assertTrue(report.getHotspots().isEmpty());
        assertThat(report.getDistribution()).containsOnlyKeys(ComplexityCategory.values())
            .allSatisfy((category, count) -> assertEquals(0, count));
    }

    @Test
    @DisplayName("Comparison classifies nodes present in both snapshots")
    void compare() {
        KnowledgeGraph before = billingGraph(25, 12);
        KnowledgeGraph after = billingGraph(18, 15);

        ComplexityComparison comparison = analyzer.compare(before, after);

        assertThat(comparison.improved()).extracting(ComplexityHotspot::getName).containsExactly("Billing.charge");
        assertEquals(18, comparison.improved().get(0).getComplexity());
        assertThat(comparison.worsened()).extracting(ComplexityHotspot::getName).containsExactly("Billing.refund");
        // files and the untouched symbols
        assertEquals(6, comparison.unchanged());
    }

    @Test
    @DisplayName("Directory totals use file scores and group root files under '.'")
    void byDirectory() {
        List<DirectoryComplexity> directories = analyzer.complexityByDirectory(billingGraph(25, 12));

        assertEquals(List.of(
            new DirectoryComplexity(".", 7, 1, 7.0),
            new DirectoryComplexity("svc", 42, 2, 21.0)), directories);
        assertEquals(".", ComplexityAnalyzer.directoryOf("Main.java"));
        assertEquals("a/b", ComplexityAnalyzer.directoryOf("a/b/C.java"));
    }

    @Test
    @DisplayName("Refactoring targets are ordered by priority")
    void refactoringTargets() {
        ClassNode longType = ClassNode.builder()
            .id(GraphNode.symbolId("svc/Report.java", NodeKind.CLASS, "Report", 1))
            .name("Report")
            .filePath("svc/Report.java")
            .lineStart(1)
            .lineEnd(81)
            .exported(true)
            .complexity(8)
            .build();
        KnowledgeGraph graph = GraphFixtures.graph(List.of(
            GraphFixtures.file("svc/Report.java", 41),
            longType,
            GraphFixtures.function("svc/Report.java", "Report.render", 10, 11, true),
            GraphFixtures.function("svc/Report.java", "Report.export", 30, 22, true)), List.of());

        List<RefactoringSuggestion> suggestions = analyzer.suggestRefactoringTargets(graph);

        assertThat(suggestions).extracting(RefactoringSuggestion::priority).containsExactly(
            RefactoringSuggestion.Priority.HIGH,
            RefactoringSuggestion.Priority.MEDIUM,
            RefactoringSuggestion.Priority.MEDIUM);
        assertEquals("Report.export", suggestions.get(0).target().getName());
        assertThat(suggestions).extracting(RefactoringSuggestion::reason).contains(
            "Spans 80 lines. Consider extracting helper methods.",
            "Cyclomatic complexity of 11 is above the recommended threshold.");
    }

    @Test
    @DisplayName("Statistics count nodes and edges by kind")
    void statistics() {
        GraphStatistics statistics = GraphStatistics.of(billingGraph(25, 12));

        assertEquals(8, statistics.getNodeCount());
        assertEquals(6, statistics.getEdgeCount());
        assertEquals(3, statistics.getNodesByKind().get(NodeKind.FILE));
        assertEquals(4, statistics.getNodesByKind().get(NodeKind.FUNCTION));
        assertEquals(1, statistics.getNodesByKind().get(NodeKind.CLASS));
        assertEquals(5, statistics.getEdgesByKind().get(EdgeKind.CONTAINS));
        assertEquals(1, statistics.getEdgesByKind().get(EdgeKind.IMPORTS));
        assertEquals(9.8, statistics.getAverageComplexity(), 1e-9);
        assertEquals(25, statistics.getMaxComplexity());
        assertEquals(GraphFixtures.ROOT, statistics.getMetadata().getRootDir());
    }

    private static KnowledgeGraph billingGraph(int charge, int refund) {
        return GraphFixtures.graph(List.of(
                GraphFixtures.file("svc/Billing.java", 40),
                GraphFixtures.type("svc/Billing.java", "Billing", 1, 3, null),
                GraphFixtures.function("svc/Billing.java", "Billing.charge", 10, charge, true),
                GraphFixtures.function("svc/Billing.java", "Billing.refund", 30, refund, true),
                GraphFixtures.file("Main.java", 7),
                GraphFixtures.function("Main.java", "Main.run", 5, 7, true),
                GraphFixtures.file("svc/Ledger.java", 2),
                GraphFixtures.function("svc/Ledger.java", "Ledger.post", 3, 2, false)),
            List.of(GraphFixtures.imports("Main.java", "svc/Billing.java")));
    }
}
