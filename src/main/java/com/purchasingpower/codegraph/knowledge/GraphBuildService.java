package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.build.BuildOptions;
import com.purchasingpower.codegraph.model.build.BuildResult;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds knowledge graph snapshots.
 *
 * <p>Phases run in order: Initializing, Analyzing AST, Resolving imports,
 * Analyzing git history (optional), Complete. Per-file failures, scan
 * timeouts and an empty file set are reported on the result; the build
 * itself does not throw for them.
 *
 * @since 1.0.0
 */
public interface GraphBuildService {

    BuildResult buildGraph(Path root, BuildOptions options);

    /**
     * Refreshes a graph after the given files changed. Currently a full rebuild.
     */
    BuildResult updateGraphIncremental(KnowledgeGraph existing, List<String> changedFiles, BuildOptions options);
}
