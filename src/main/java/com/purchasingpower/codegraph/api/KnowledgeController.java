package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.analysis.ComplexityReport;
import com.purchasingpower.codegraph.analysis.FileChurn;
import com.purchasingpower.codegraph.analysis.GraphStatistics;
import com.purchasingpower.codegraph.exception.GraphNotFoundException;
import com.purchasingpower.codegraph.model.build.BuildOptions;
import com.purchasingpower.codegraph.model.build.BuildPhase;
import com.purchasingpower.codegraph.model.build.BuildResult;
import com.purchasingpower.codegraph.model.embedding.EmbeddingIndex;
import com.purchasingpower.codegraph.model.graph.FileRelationships;
import com.purchasingpower.codegraph.model.graph.ImpactAnalysisReport;
import com.purchasingpower.codegraph.service.KnowledgeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * REST controller for scanning, indexing and graph queries.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/graph")
@RequiredArgsConstructor
public class KnowledgeController {

    private final KnowledgeService knowledgeService;

    /**
     * Scan a repository and store its graph.
     *
     * POST /api/v1/graph/scan
     */
    @PostMapping("/scan")
    public ResponseEntity<ScanResponse> scan(@RequestBody ScanRequest request) {
        try {
            if (request.getRootPath() == null || request.getRootPath().isBlank()) {
                return ResponseEntity.badRequest()
                    .body(ScanResponse.error("Root path is required"));
            }

            Path root = Path.of(request.getRootPath());
            if (!Files.isDirectory(root)) {
                return ResponseEntity.badRequest()
                    .body(ScanResponse.error("Not a directory: " + request.getRootPath()));
            }

            log.info("Scanning repository: {}", root);

            BuildOptions options = BuildOptions.builder()
                .includeHistory(request.getIncludeHistory())
                .timeoutMs(request.getTimeoutMs())
                .fileTimeoutMs(request.getFileTimeoutMs())
                .progressListener(KnowledgeController::logProgress)
                .build();

            BuildResult result = knowledgeService.scan(root, options);
            return ResponseEntity.ok(ScanResponse.success(result));

        } catch (Exception e) {
            log.error("Scan failed", e);
            return ResponseEntity.internalServerError()
                .body(ScanResponse.error("Scan failed: " + e.getMessage()));
        }
    }

    /**
     * Build the embedding index of a scanned repository.
     *
     * POST /api/v1/graph/index
     */
    @PostMapping("/index")
    public ResponseEntity<IndexResponse> index(@RequestBody IndexRequest request) {
        try {
            if (request.getRootPath() == null || request.getRootPath().isBlank()) {
                return ResponseEntity.badRequest()
                    .body(IndexResponse.error("Root path is required"));
            }

            long start = System.currentTimeMillis();
            EmbeddingIndex index = knowledgeService.index(Path.of(request.getRootPath()));
            return ResponseEntity.ok(IndexResponse.success(
                index.getChunkCount(),
                index.getVocabularySize(),
                System.currentTimeMillis() - start
            ));

        } catch (GraphNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(IndexResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Indexing failed", e);
            return ResponseEntity.internalServerError()
                .body(IndexResponse.error("Indexing failed: " + e.getMessage()));
        }
    }

    /**
     * Node and edge counts of the stored graph.
     *
     * GET /api/v1/graph/stats?rootPath=...
     */
    @GetMapping("/stats")
    public ResponseEntity<GraphStatistics> getStatistics(@RequestParam String rootPath) {
        try {
            return ResponseEntity.ok(knowledgeService.statistics(Path.of(rootPath)));
        } catch (GraphNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.error("Failed to get graph statistics", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * GET /api/v1/graph/complexity?rootPath=...
     */
    @GetMapping("/complexity")
    public ResponseEntity<ComplexityReport> getComplexity(@RequestParam String rootPath) {
        try {
            return ResponseEntity.ok(knowledgeService.complexity(Path.of(rootPath)));
        } catch (GraphNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.error("Failed to get complexity report", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Imports, importers and exports of one file.
     *
     * GET /api/v1/graph/relationships?rootPath=...&filePath=...
     */
    @GetMapping("/relationships")
    public ResponseEntity<FileRelationships> getRelationships(@RequestParam String rootPath,
                                                              @RequestParam String filePath) {
        try {
            return ResponseEntity.ok(knowledgeService.relationships(Path.of(rootPath), filePath));
        } catch (GraphNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.error("Failed to get file relationships", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * GET /api/v1/graph/impact?rootPath=...&filePath=...
     */
    @GetMapping("/impact")
    public ResponseEntity<ImpactAnalysisReport> getImpact(@RequestParam String rootPath,
                                                          @RequestParam String filePath) {
        try {
            return ResponseEntity.ok(knowledgeService.impact(Path.of(rootPath), filePath));
        } catch (GraphNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.error("Failed to analyze impact", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Most frequently changed files.
     *
     * GET /api/v1/graph/hot-files?rootPath=...&threshold=10
     */
    @GetMapping("/hot-files")
    public ResponseEntity<List<FileChurn>> getHotFiles(@RequestParam String rootPath,
                                                       @RequestParam(defaultValue = "10") int threshold) {
        if (threshold < 1) {
            return ResponseEntity.badRequest().build();
        }
        try {
            return ResponseEntity.ok(knowledgeService.hotFiles(Path.of(rootPath), threshold));
        } catch (GraphNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.error("Failed to find hot files", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    private static void logProgress(BuildPhase phase, int completed, int total, String currentFile) {
        if (currentFile == null) {
            log.info("📊 {} ({}/{})", phase.getLabel(), completed, total);
        } else {
            log.debug("📊 {} ({}/{}): {}", phase.getLabel(), completed, total, currentFile);
        }
    }
}
