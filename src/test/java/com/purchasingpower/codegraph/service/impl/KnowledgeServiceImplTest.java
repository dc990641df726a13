package com.purchasingpower.codegraph.service.impl;

import com.purchasingpower.codegraph.analysis.GraphStatistics;
import com.purchasingpower.codegraph.core.SearchMode;
import com.purchasingpower.codegraph.exception.GraphNotFoundException;
import com.purchasingpower.codegraph.exception.IndexNotFoundException;
import com.purchasingpower.codegraph.model.build.BuildOptions;
import com.purchasingpower.codegraph.model.build.BuildResult;
import com.purchasingpower.codegraph.model.embedding.EmbeddingIndex;
import com.purchasingpower.codegraph.model.graph.FileRelationships;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.search.SearchOutcome;
import com.purchasingpower.codegraph.search.impl.DefaultSearchOptions;
import com.purchasingpower.codegraph.service.KnowledgeService;
import com.purchasingpower.codegraph.storage.StorageLayout;
import com.purchasingpower.codegraph.support.SourceFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Scan, index and query a small repository through the wired service.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Knowledge Service Tests")
class KnowledgeServiceImplTest {

    private static final String MONEY = "src/main/java/shop/util/Money.java";
    private static final String ORDER = "src/main/java/shop/Order.java";

    @Autowired
    private KnowledgeService knowledgeService;

    @Autowired
    private StorageLayout storageLayout;

    @TempDir
    Path root;

    @BeforeEach
    void setUp() {
        SourceFixtures.write(root, ORDER, """
            package shop;

            import shop.util.Money;

            /** A customer order. */
            public class Order {
                public Money total() { return new Money(); }
            }
            """);
        SourceFixtures.write(root, MONEY, """
            package shop.util;

            /** Amount of currency in cents. */
            public class Money {
                public boolean positive(long cents) { return cents > 0 && cents < 100; }
            }
            """);
    }

    @Test
    @DisplayName("Scan stores a graph that later operations load")
    void scanStoresGraph() {
        BuildResult result = knowledgeService.scan(root, noHistory());

        assertFalse(result.hasErrors());
        assertTrue(Files.isRegularFile(storageLayout.graphFile(root)));

        KnowledgeGraph loaded = knowledgeService.loadGraph(root.resolve("src").resolve(".."));
        assertEquals(result.getGraph().getNodes().keySet(), loaded.getNodes().keySet());
        assertEquals(result.getGraph().getEdges().size(), loaded.getEdges().size());

        GraphStatistics statistics = knowledgeService.statistics(root);
        assertEquals(2, statistics.getNodesByKind().get(NodeKind.FILE));
        assertEquals(2, statistics.getNodesByKind().get(NodeKind.CLASS));
    }

    @Test
    @DisplayName("Operations on an unscanned root fail with GraphNotFoundException")
    void unscannedRoot() {
        assertThatThrownBy(() -> knowledgeService.loadGraph(root))
            .isInstanceOf(GraphNotFoundException.class)
            .hasMessageContaining("Run a scan first");
        assertThatThrownBy(() -> knowledgeService.index(root))
            .isInstanceOf(GraphNotFoundException.class);
        assertThatThrownBy(() -> knowledgeService.search(root, "money", options(SearchMode.KEYWORD)))
            .isInstanceOf(GraphNotFoundException.class);
    }

    @Test
    @DisplayName("Hybrid search uses the index once it is built")
    void scanIndexSearch() {
        knowledgeService.scan(root, noHistory());

        SearchOutcome beforeIndex = knowledgeService.search(root, "money", options(SearchMode.HYBRID));
        assertEquals(SearchMode.KEYWORD, beforeIndex.getMode());
        assertThatThrownBy(() -> knowledgeService.search(root, "money", options(SearchMode.SEMANTIC)))
            .isInstanceOf(IndexNotFoundException.class);

        EmbeddingIndex index = knowledgeService.index(root);
        assertEquals(knowledgeService.loadGraph(root).getNodes().size(), index.getChunkCount());

        SearchOutcome outcome = knowledgeService.search(root, "money", options(SearchMode.HYBRID));
        assertEquals(SearchMode.HYBRID, outcome.getMode());
        assertEquals("Money", outcome.getResults().get(0).getName());

        SearchOutcome semantic = knowledgeService.search(root, "currency cents", options(SearchMode.SEMANTIC));
        assertThat(semantic.getResults()).isNotEmpty();
        assertEquals("Money", semantic.getResults().get(0).getName());
    }

    @Test
    @DisplayName("An index older than the graph is ignored")
    void staleIndexIgnored() throws Exception {
        knowledgeService.scan(root, noHistory());
        knowledgeService.index(root);
        Files.setLastModifiedTime(storageLayout.graphFile(root), FileTime.from(Instant.now().plusSeconds(60)));

        SearchOutcome outcome = knowledgeService.search(root, "money", options(SearchMode.HYBRID));

        assertEquals(SearchMode.KEYWORD, outcome.getMode());
    }

    @Test
    @DisplayName("Relationship and impact queries run against the stored graph")
    void graphQueries() {
        knowledgeService.scan(root, noHistory());

        FileRelationships relationships = knowledgeService.relationships(root, MONEY);
        assertTrue(relationships.isExists());
        assertThat(relationships.getImportedBy()).extracting(FileRelationships.ImportLink::filePath)
            .containsExactly(ORDER);

        assertEquals(1, knowledgeService.impact(root, MONEY).getDirectDependents().size());
        assertThat(knowledgeService.complexity(root).getTotalComplexity()).isPositive();
    }

    private static BuildOptions noHistory() {
        return BuildOptions.builder().includeHistory(false).build();
    }

    private static DefaultSearchOptions options(SearchMode mode) {
        return DefaultSearchOptions.builder().mode(mode).limit(10).build();
    }
}
