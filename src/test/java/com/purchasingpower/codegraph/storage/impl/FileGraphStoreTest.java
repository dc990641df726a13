package com.purchasingpower.codegraph.storage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.JacksonConfig;
import com.purchasingpower.codegraph.model.graph.GraphMetadata;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.model.history.RepositoryStats;
import com.purchasingpower.codegraph.parser.JavaSourceFileDiscovery;
import com.purchasingpower.codegraph.storage.StorageLayout;
import com.purchasingpower.codegraph.support.GraphFixtures;
import com.purchasingpower.codegraph.support.SourceFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("File Graph Store Tests")
class FileGraphStoreTest {

    @TempDir
    Path root;

    private ObjectMapper objectMapper;
    private FileGraphStore store;
    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        CodeGraphProperties properties = new CodeGraphProperties();
        objectMapper = JacksonConfig.create();
        store = new FileGraphStore(new StorageLayout(properties), objectMapper, new JavaSourceFileDiscovery(properties));
        GraphNode history = GraphFixtures.file("src/main/java/shop/Order.java", 4)
            .withHistory(Instant.parse("2023-06-01T12:00:00Z"), 3, List.of("Alice", "Bob"));
        graph = GraphFixtures.graph(List.of(
                history,
                GraphFixtures.type("src/main/java/shop/Order.java", "Order", 3, 4, "An order."),
                GraphFixtures.function("src/main/java/shop/Order.java", "Order.total", 10, 2, true),
                GraphFixtures.file("src/main/java/shop/Money.java", 1)),
            List.of(GraphFixtures.imports("src/main/java/shop/Order.java", "src/main/java/shop/Money.java")));
    }

    @Test
    @DisplayName("Saved graph loads back equal, node kinds included")
    void roundTrip() {
        store.save(root, graph);

        KnowledgeGraph loaded = store.load(root).orElseThrow();

        assertEquals(graph.getNodes(), loaded.getNodes());
        assertEquals(graph.getEdges(), loaded.getEdges());
        assertEquals(graph.getMetadata(), loaded.getMetadata());
        assertEquals(KnowledgeGraph.CURRENT_VERSION, loaded.getVersion());
        assertEquals(graph.getMetadata(), store.loadMetadata(root).orElseThrow());
    }

    @Test
    @DisplayName("Kind is written as the type property and absent fields are omitted")
    void jsonShape() throws Exception {
        store.save(root, graph);

        JsonNode json = objectMapper.readTree(store.graphFile(root).toFile());
        JsonNode function = json.get("nodes").get("src/main/java/shop/Order.java:function:Order.total:10");
        assertEquals("function", function.get("type").asText());
        assertFalse(function.has("documentation"));
        assertFalse(function.has("lastModified"));
        assertEquals("2023-06-01T12:00:00Z", json.get("nodes").get("src/main/java/shop/Order.java").get("lastModified").asText());
        assertFalse(Files.readString(store.graphFile(root)).contains("null"));
    }

    @Test
    @DisplayName("Nothing stored loads as empty and counts as stale")
    void missingGraph() {
        assertFalse(store.exists(root));
        assertTrue(store.load(root).isEmpty());
        assertTrue(store.isGraphStale(root));
    }

    @Test
    @DisplayName("Graph goes stale when a source file changes after the scan")
    void staleness() throws Exception {
        Path source = SourceFixtures.write(root, "src/main/java/shop/Order.java", "class Order {}");
        Files.setLastModifiedTime(source, FileTime.from(Instant.parse("2023-12-01T00:00:00Z")));
        store.save(root, graph);

        assertFalse(store.isGraphStale(root));

        Files.setLastModifiedTime(source, FileTime.from(Instant.parse("2024-02-01T00:00:00Z")));
        assertTrue(store.isGraphStale(root));
    }

    @Test
    @DisplayName("Delete removes the stored graph and metadata")
    void delete() {
        store.save(root, graph);

        store.delete(root);

        assertFalse(store.exists(root));
        assertTrue(store.loadMetadata(root).isEmpty());
    }

    @Test
    @DisplayName("Metadata reflects the snapshot")
    void metadata() {
        store.save(root, graph);

        GraphMetadata metadata = store.loadMetadata(root).orElseThrow();

        assertEquals(GraphFixtures.ROOT, metadata.getRootDir());
        assertEquals(2, metadata.getFileCount());
    }

    @Test
    @DisplayName("Repository stats survive a save and load")
    void repositoryStatsRoundTrip() {
        RepositoryStats stats = RepositoryStats.builder()
            .totalCommits(7)
            .contributorCount(2)
            .firstCommit(Instant.parse("2022-02-01T08:00:00Z"))
            .lastCommit(Instant.parse("2023-06-01T12:00:00Z"))
            .build();
        GraphMetadata withStats = GraphMetadata.builder()
            .scannedAt(graph.getMetadata().getScannedAt())
            .rootDir(GraphFixtures.ROOT)
            .fileCount(2)
            .nodeCount(graph.getNodes().size())
            .edgeCount(graph.getEdges().size())
            .repository(stats)
            .build();
        store.save(root, KnowledgeGraph.snapshot(withStats, graph.getNodes(), graph.getEdges()));

        assertEquals(stats, store.loadMetadata(root).orElseThrow().getRepository());
    }
}
