package com.purchasingpower.codegraph.model.graph;

import com.purchasingpower.codegraph.support.GraphFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Knowledge Graph Tests")
class KnowledgeGraphTest {

    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        graph = GraphFixtures.graph(List.of(
                GraphFixtures.file("shop/Order.java", 3),
                GraphFixtures.type("shop/Order.java", "Order", 3, 2, null),
                GraphFixtures.function("shop/Order.java", "Order.total", 8, 1, true),
                GraphFixtures.file("shop/Money.java", 1)),
            List.of(GraphFixtures.imports("shop/Order.java", "shop/Money.java")));
    }

    @Test
    @DisplayName("Should look up nodes by id, file and type")
    void lookups() {
        assertEquals("Order", graph.findNode("shop/Order.java:class:Order:3").orElseThrow().getName());
        assertTrue(graph.findNode("shop/Nope.java").isEmpty());
        assertThat(graph.nodesInFile("shop/Order.java")).extracting(GraphNode::getName)
            .containsExactly("Order.java", "Order", "Order.total");
        assertThat(graph.nodesOfType(FileNode.class)).extracting(FileNode::getId)
            .containsExactly("shop/Order.java", "shop/Money.java");
    }

    @Test
    @DisplayName("Should filter edges by kind")
    void edgesByKind() {
        assertThat(graph.edgesOfType(EdgeKind.CONTAINS)).hasSize(2);
        assertThat(graph.edgesOfType(EdgeKind.IMPORTS)).extracting(GraphEdge::getTarget)
            .containsExactly("shop/Money.java");
        assertTrue(graph.edgesOfType(EdgeKind.EXTENDS).isEmpty());
    }

    @Test
    @DisplayName("Should list the files importing a file")
    void dependents() {
        assertEquals(Set.of("shop/Order.java"), graph.dependentsOf("shop/Money.java"));
        assertTrue(graph.dependentsOf("shop/Order.java").isEmpty());
    }

    @Test
    @DisplayName("Snapshots cannot be modified")
    void immutable() {
        assertEquals(KnowledgeGraph.CURRENT_VERSION, graph.getVersion());
        assertThatThrownBy(() -> graph.getNodes().remove("shop/Money.java"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> graph.getEdges().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
