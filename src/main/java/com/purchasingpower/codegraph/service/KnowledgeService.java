package com.purchasingpower.codegraph.service;

import com.purchasingpower.codegraph.analysis.ComplexityReport;
import com.purchasingpower.codegraph.analysis.FileChurn;
import com.purchasingpower.codegraph.analysis.GraphStatistics;
import com.purchasingpower.codegraph.model.build.BuildOptions;
import com.purchasingpower.codegraph.model.build.BuildResult;
import com.purchasingpower.codegraph.model.embedding.EmbeddingIndex;
import com.purchasingpower.codegraph.model.graph.FileRelationships;
import com.purchasingpower.codegraph.model.graph.ImpactAnalysisReport;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.search.SearchOptions;
import com.purchasingpower.codegraph.search.SearchOutcome;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point tying the build pipeline to persistence. Every operation takes
 * the repository root; stored artifacts live under that root.
 *
 * @since 1.0.0
 */
public interface KnowledgeService {

    /**
     * Builds a fresh graph and stores it, replacing any previous snapshot.
     */
    BuildResult scan(Path root, BuildOptions options);

    /**
     * Builds and stores the embedding index for the stored graph.
     *
     * @throws com.purchasingpower.codegraph.exception.GraphNotFoundException if no graph is stored
     */
    EmbeddingIndex index(Path root);

    /**
     * Searches the stored graph. A stale or missing index is not used: hybrid
     * search falls back to keywords and semantic search fails.
     *
     * @throws com.purchasingpower.codegraph.exception.GraphNotFoundException if no graph is stored
     * @throws com.purchasingpower.codegraph.exception.IndexNotFoundException for semantic search without a usable index
     */
    SearchOutcome search(Path root, String query, SearchOptions options);

    KnowledgeGraph loadGraph(Path root);

    GraphStatistics statistics(Path root);

    ComplexityReport complexity(Path root);

    FileRelationships relationships(Path root, String filePath);

    ImpactAnalysisReport impact(Path root, String filePath);

    /**
     * Files changed in at least {@code threshold} commits, with their churn
     * scores as of now. Empty when the graph was scanned without history.
     */
    List<FileChurn> hotFiles(Path root, int threshold);
}
