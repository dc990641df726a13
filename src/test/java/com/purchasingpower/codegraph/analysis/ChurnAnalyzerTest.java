package com.purchasingpower.codegraph.analysis;

import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.support.GraphFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Churn Analyzer Tests")
class ChurnAnalyzerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

    private final ChurnAnalyzer analyzer = new ChurnAnalyzer();

    @Test
    @DisplayName("Hot files reach the modification threshold and sort by modifications")
    void hotFiles() {
        KnowledgeGraph graph = historyGraph();

        assertThat(analyzer.findHotFiles(graph, NOW)).extracting(FileChurn::getFilePath)
            .containsExactly("billing/Ledger.java", "billing/Invoice.java", "billing/Tax.java");
        assertThat(analyzer.findHotFiles(graph, 30, NOW)).extracting(FileChurn::getFilePath)
            .containsExactly("billing/Ledger.java");
    }

    @Test
    @DisplayName("Files scanned without history are never hot")
    void noHistory() {
        KnowledgeGraph graph = GraphFixtures.graph(
            List.of(GraphFixtures.file("billing/Plain.java", 1)), List.of());

        assertTrue(analyzer.findHotFiles(graph, 0, NOW).isEmpty());
        assertEquals(0.0, analyzer.churnScore(graph.getNodes().get("billing/Plain.java"), NOW), 1e-9);
    }

    @Test
    @DisplayName("Churn score weighs commits, contributors and recency")
    void churnScore() {
        KnowledgeGraph graph = historyGraph();

        // saturated on every factor
        assertEquals(1.0, analyzer.churnScore(graph.getNodes().get("billing/Ledger.java"), NOW), 1e-9);
        // 10/50 * 0.4 + 1/5 * 0.3 + (1 - 90/180) * 0.3
        assertEquals(0.29, analyzer.churnScore(graph.getNodes().get("billing/Tax.java"), NOW), 1e-9);
        // untouched for longer than the recency window
        assertEquals(0.32, analyzer.churnScore(graph.getNodes().get("billing/Invoice.java"), NOW), 1e-9);
    }

    @Test
    @DisplayName("Recency fades linearly and stays within bounds")
    void recency() {
        assertEquals(1.0, ChurnAnalyzer.recency(NOW, NOW), 1e-9);
        assertEquals(0.5, ChurnAnalyzer.recency(NOW.minus(Duration.ofDays(90)), NOW), 1e-9);
        assertEquals(0.0, ChurnAnalyzer.recency(NOW.minus(Duration.ofDays(365)), NOW), 1e-9);
        assertEquals(1.0, ChurnAnalyzer.recency(NOW.plus(Duration.ofDays(3)), NOW), 1e-9);
        assertEquals(0.0, ChurnAnalyzer.recency(null, NOW), 1e-9);
    }

    @Test
    @DisplayName("Churn entries carry the recorded history")
    void churnOf() {
        FileChurn churn = analyzer.churnOf(historyGraph().getNodes().get("billing/Invoice.java"), NOW);

        assertEquals(25, churn.getModificationCount());
        assertEquals(2, churn.getContributorCount());
        assertEquals(NOW.minus(Duration.ofDays(400)), churn.getLastModified());
    }

    private static KnowledgeGraph historyGraph() {
        List<GraphNode> nodes = List.of(
            GraphFixtures.file("billing/Ledger.java", 3)
                .withHistory(NOW, 60, List.of("Ana", "Ben", "Cy", "Dee", "Eve", "Fay")),
            GraphFixtures.file("billing/Tax.java", 2)
                .withHistory(NOW.minus(Duration.ofDays(90)), 10, List.of("Ana")),
            GraphFixtures.file("billing/Rounding.java", 1)
                .withHistory(NOW.minus(Duration.ofDays(5)), 9, List.of("Ben")),
            GraphFixtures.file("billing/Invoice.java", 4)
                .withHistory(NOW.minus(Duration.ofDays(400)), 25, List.of("Ana", "Cy")),
            GraphFixtures.file("billing/Plain.java", 1));
        return GraphFixtures.graph(nodes, List.of());
    }
}
