package com.purchasingpower.codegraph.service.impl;

import com.purchasingpower.codegraph.analysis.ChurnAnalyzer;
import com.purchasingpower.codegraph.analysis.ComplexityAnalyzer;
import com.purchasingpower.codegraph.analysis.ComplexityReport;
import com.purchasingpower.codegraph.analysis.FileChurn;
import com.purchasingpower.codegraph.analysis.GraphStatistics;
import com.purchasingpower.codegraph.embedding.EmbeddingIndexService;
import com.purchasingpower.codegraph.exception.GraphNotFoundException;
import com.purchasingpower.codegraph.knowledge.GraphBuildService;
import com.purchasingpower.codegraph.model.build.BuildOptions;
import com.purchasingpower.codegraph.model.build.BuildResult;
import com.purchasingpower.codegraph.model.embedding.EmbeddingIndex;
import com.purchasingpower.codegraph.model.graph.FileRelationships;
import com.purchasingpower.codegraph.model.graph.ImpactAnalysisReport;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.search.SearchOptions;
import com.purchasingpower.codegraph.search.SearchOutcome;
import com.purchasingpower.codegraph.search.SearchService;
import com.purchasingpower.codegraph.service.KnowledgeService;
import com.purchasingpower.codegraph.service.graph.GraphTraversalService;
import com.purchasingpower.codegraph.storage.EmbeddingIndexStore;
import com.purchasingpower.codegraph.storage.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeServiceImpl implements KnowledgeService {

    private final GraphBuildService graphBuildService;
    private final GraphStore graphStore;
    private final EmbeddingIndexService embeddingIndexService;
    private final EmbeddingIndexStore embeddingIndexStore;
    private final SearchService searchService;
    private final GraphTraversalService graphTraversalService;
    private final ComplexityAnalyzer complexityAnalyzer;
    private final ChurnAnalyzer churnAnalyzer;

    @Override
    public BuildResult scan(Path root, BuildOptions options) {
        Path normalized = normalize(root);
        BuildResult result = graphBuildService.buildGraph(normalized, options);
        graphStore.save(normalized, result.getGraph());
        log.info("✅ Scan of {} stored: {} nodes, {} errors, {} warnings",
            normalized, result.getGraph().getNodes().size(), result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    @Override
    public EmbeddingIndex index(Path root) {
        Path normalized = normalize(root);
        KnowledgeGraph graph = loadGraph(normalized);
        EmbeddingIndex index = embeddingIndexService.buildIndex(graph);
        embeddingIndexStore.save(normalized, index);
        return index;
    }

    @Override
    public SearchOutcome search(Path root, String query, SearchOptions options) {
        Path normalized = normalize(root);
        KnowledgeGraph graph = loadGraph(normalized);

        EmbeddingIndex index = null;
        if (embeddingIndexStore.isStale(normalized)) {
            log.debug("Embedding index for {} is missing or stale; not used", normalized);
        } else {
            index = embeddingIndexStore.load(normalized).orElse(null);
        }
        return searchService.search(query, graph, index, options);
    }

    @Override
    public KnowledgeGraph loadGraph(Path root) {
        Path normalized = normalize(root);
        return graphStore.load(normalized)
            .orElseThrow(() -> new GraphNotFoundException(normalized.toString()));
    }

    @Override
    public GraphStatistics statistics(Path root) {
        return GraphStatistics.of(loadGraph(root));
    }

    @Override
    public ComplexityReport complexity(Path root) {
        return complexityAnalyzer.generateReport(loadGraph(root));
    }

    @Override
    public FileRelationships relationships(Path root, String filePath) {
        return graphTraversalService.getFileRelationships(loadGraph(root), filePath);
    }

    @Override
    public ImpactAnalysisReport impact(Path root, String filePath) {
        return graphTraversalService.analyzeImpact(loadGraph(root), filePath);
    }

    @Override
    public List<FileChurn> hotFiles(Path root, int threshold) {
        return churnAnalyzer.findHotFiles(loadGraph(root), threshold, Instant.now());
    }

    private static Path normalize(Path root) {
        return root.toAbsolutePath().normalize();
    }
}
