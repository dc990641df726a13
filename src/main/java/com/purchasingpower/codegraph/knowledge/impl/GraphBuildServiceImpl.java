package com.purchasingpower.codegraph.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.ScanProperties;
import com.purchasingpower.codegraph.knowledge.GraphBuildService;
import com.purchasingpower.codegraph.knowledge.HistoryEnricher;
import com.purchasingpower.codegraph.knowledge.RelationshipResolver;
import com.purchasingpower.codegraph.knowledge.ResolvedRelationships;
import com.purchasingpower.codegraph.knowledge.SymbolExtractor;
import com.purchasingpower.codegraph.model.ast.FileExtraction;
import com.purchasingpower.codegraph.model.build.BuildOptions;
import com.purchasingpower.codegraph.model.build.BuildPhase;
import com.purchasingpower.codegraph.model.build.BuildResult;
import com.purchasingpower.codegraph.model.build.ProgressListener;
import com.purchasingpower.codegraph.model.build.ScanError;
import com.purchasingpower.codegraph.model.build.ScanWarning;
import com.purchasingpower.codegraph.model.graph.EdgeKind;
import com.purchasingpower.codegraph.model.graph.FileNode;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphMetadata;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.model.history.HistoryResult;
import com.purchasingpower.codegraph.model.history.RepositoryStats;
import com.purchasingpower.codegraph.parser.FileStatsCache;
import com.purchasingpower.codegraph.parser.SourceFileDiscovery;
import com.purchasingpower.codegraph.parser.SourceParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Orchestrates discovery, extraction, resolution and history enrichment into
 * one immutable {@link KnowledgeGraph}.
 *
 * <p>Extraction runs on a bounded set of workers. Finished files are merged in
 * path order, so the snapshot does not depend on completion order. Output of
 * files that failed, timed out or were abandoned is never merged.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphBuildServiceImpl implements GraphBuildService {

    static final String NO_FILES_MESSAGE = "No source files found";
    static final String NOT_A_REPOSITORY_MESSAGE = "Not a git repository. Git history analysis skipped.";

    private final SourceFileDiscovery sourceFileDiscovery;
    private final SourceParser sourceParser;
    private final SymbolExtractor symbolExtractor;
    private final RelationshipResolver relationshipResolver;
    private final HistoryEnricher historyEnricher;
    private final CodeGraphProperties properties;

    @Override
    public BuildResult buildGraph(Path root, BuildOptions options) {
        Preconditions.checkNotNull(root, "root must not be null");
        BuildOptions effective = options != null ? options : BuildOptions.defaults();
        ScanProperties scan = properties.getScan();
        boolean includeHistory = effective.getIncludeHistory() != null
            ? effective.getIncludeHistory() : scan.isIncludeHistory();
        long timeoutMs = effective.getTimeoutMs() != null ? effective.getTimeoutMs() : scan.getTimeoutMs();
        long fileTimeoutMs = effective.getFileTimeoutMs() != null ? effective.getFileTimeoutMs() : scan.getFileTimeoutMs();
        ProgressListener progress = effective.getProgressListener() != null
            ? effective.getProgressListener() : ProgressListener.NONE;

        Instant scannedAt = Instant.now();
        long startNanos = System.nanoTime();
        String rootDir = root.toAbsolutePath().normalize().toString();
        List<ScanError> errors = new ArrayList<>();
        List<ScanWarning> warnings = new ArrayList<>();

        progress.onProgress(BuildPhase.INITIALIZING, 0, 0, null);
        List<String> files = discover(root, rootDir, errors);
        if (files.isEmpty()) {
            log.warn("⚠️ No source files found under {}", rootDir);
            errors.add(ScanError.scan(rootDir, NO_FILES_MESSAGE));
            progress.onProgress(BuildPhase.COMPLETE, 0, 0, null);
            GraphMetadata metadata = metadata(scannedAt, startNanos, rootDir, List.of(), Map.of(), List.of(), null);
            return BuildResult.of(KnowledgeGraph.snapshot(metadata, Map.of(), List.of()), errors, warnings);
        }
        log.info("🚀 Scanning {} source files under {}", files.size(), rootDir);

        FileStatsCache fileStats = new FileStatsCache();
        try {
            FileExtractionRunner runner = new FileExtractionRunner(scan.getWorkerThreads(), fileTimeoutMs);
            FileExtractionRunner.Outcome outcome = runner.run(
                files,
                file -> symbolExtractor.extract(sourceParser.parse(root, file, fileStats)),
                startNanos + TimeUnit.MILLISECONDS.toNanos(timeoutMs),
                (settled, total, file) -> progress.onProgress(BuildPhase.ANALYZING_AST, settled, total, file));
            errors.addAll(outcome.errors());
            if (outcome.timedOut()) {
                log.warn("⏱️ Scan timeout of {}ms exceeded after {}/{} files", timeoutMs, outcome.settled(), files.size());
                errors.add(ScanError.scan(rootDir,
                    "Scan timeout exceeded (" + timeoutMs + "ms). Partial results returned."));
            }

            List<FileExtraction> extractions = files.stream()
                .map(outcome.completed()::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

            Map<String, GraphNode> nodes = new LinkedHashMap<>();
            List<GraphEdge> edges = new ArrayList<>();
            for (FileExtraction extraction : extractions) {
                FileNode fileNode = extraction.getFileNode();
                nodes.put(fileNode.getId(), fileNode);
                for (GraphNode symbol : extraction.getSymbols()) {
                    nodes.put(symbol.getId(), symbol);
                    edges.add(GraphEdge.builder()
                        .id("contains-" + edges.size())
                        .source(fileNode.getId())
                        .target(symbol.getId())
                        .type(EdgeKind.CONTAINS)
                        .build());
                }
            }

            progress.onProgress(BuildPhase.RESOLVING_IMPORTS, 0, extractions.size(), null);
            ResolvedRelationships relationships = relationshipResolver.resolve(extractions);
            edges.addAll(relationships.getEdges());
            for (FileExtraction extraction : extractions) {
                String path = extraction.getFilePath();
                nodes.put(path, extraction.getFileNode().withDependencyCounts(
                    relationships.dependencyCount(path), relationships.dependentCount(path)));
            }
            progress.onProgress(BuildPhase.RESOLVING_IMPORTS, extractions.size(), extractions.size(), null);

            RepositoryStats repositoryStats = null;
            if (includeHistory && !extractions.isEmpty()) {
                List<String> paths = extractions.stream().map(FileExtraction::getFilePath).collect(Collectors.toList());
                repositoryStats = enrichHistory(root, rootDir, paths, nodes, warnings, progress);
            }

            GraphMetadata metadata = metadata(scannedAt, startNanos, rootDir, extractions,
                nodes, edges, repositoryStats);
            KnowledgeGraph graph = KnowledgeGraph.snapshot(metadata, nodes, edges);
            progress.onProgress(BuildPhase.COMPLETE, extractions.size(), files.size(), null);
            log.info("✅ Graph built: {} files, {} nodes, {} edges in {}ms ({} errors, {} warnings)",
                metadata.getFileCount(), metadata.getNodeCount(), metadata.getEdgeCount(),
                metadata.getScanDurationMs(), errors.size(), warnings.size());
            return BuildResult.of(graph, errors, warnings);
        } finally {
            fileStats.clear();
        }
    }

    @Override
    public BuildResult updateGraphIncremental(KnowledgeGraph existing, List<String> changedFiles, BuildOptions options) {
        Preconditions.checkNotNull(existing, "existing graph must not be null");
        log.info("🔄 Incremental update requested for {} changed files, performing full rebuild",
            changedFiles != null ? changedFiles.size() : 0);
        return buildGraph(Paths.get(existing.getMetadata().getRootDir()), options);
    }

    private List<String> discover(Path root, String rootDir, List<ScanError> errors) {
        try {
            return sourceFileDiscovery.discover(root).stream()
                .filter(sourceParser::supports)
                .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            log.error("❌ Failed to discover source files under {}", rootDir, e);
            errors.add(ScanError.scan(rootDir, "File discovery failed: " + e.getMessage()));
            return List.of();
        }
    }

    /**
     * Attaches history to file nodes and returns the repository stats, or
     * {@code null} when no history could be collected.
     */
    private RepositoryStats enrichHistory(Path root, String rootDir, List<String> paths, Map<String, GraphNode> nodes,
                                          List<ScanWarning> warnings, ProgressListener progress) {
        progress.onProgress(BuildPhase.ANALYZING_HISTORY, 0, paths.size(), null);
        try {
            HistoryResult history = historyEnricher.enrich(root, paths,
                (completed, total) -> progress.onProgress(BuildPhase.ANALYZING_HISTORY, completed, total, null));
            if (!history.isVersionControlled()) {
                warnings.add(new ScanWarning(rootDir, NOT_A_REPOSITORY_MESSAGE));
                return null;
            }
            for (String path : paths) {
                history.historyOf(path).ifPresent(fileHistory -> nodes.put(path, nodes.get(path).withHistory(
                    fileHistory.getLastModified(), fileHistory.getCommitCount(), fileHistory.getContributors())));
            }
            return history.getRepositoryStats();
        } catch (RuntimeException e) {
            log.warn("⚠️ Git history analysis failed for {}: {}", rootDir, e.getMessage(), e);
            warnings.add(new ScanWarning(rootDir, "Git history analysis failed: " + e.getMessage()));
            return null;
        }
    }

    private static GraphMetadata metadata(Instant scannedAt, long startNanos, String rootDir,
                                          List<FileExtraction> extractions, Map<String, GraphNode> nodes,
                                          List<GraphEdge> edges, RepositoryStats repositoryStats) {
        Map<String, Integer> languages = new TreeMap<>();
        long totalLines = 0;
        for (FileExtraction extraction : extractions) {
            FileNode fileNode = extraction.getFileNode();
            languages.merge(fileNode.getLanguage(), 1, Integer::sum);
            totalLines += fileNode.getLineCount();
        }
        return GraphMetadata.builder()
            .scannedAt(scannedAt)
            .scanDurationMs(Duration.ofNanos(System.nanoTime() - startNanos).toMillis())
            .rootDir(rootDir)
            .fileCount(extractions.size())
            .totalLines(totalLines)
            .languages(languages)
            .nodeCount(nodes.size())
            .edgeCount(edges.size())
            .repository(repositoryStats)
            .build();
    }
}
