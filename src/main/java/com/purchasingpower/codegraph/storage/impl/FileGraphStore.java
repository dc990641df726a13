package com.purchasingpower.codegraph.storage.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.exception.GraphStorageException;
import com.purchasingpower.codegraph.model.graph.GraphMetadata;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.parser.FileStatsCache;
import com.purchasingpower.codegraph.parser.SourceFileDiscovery;
import com.purchasingpower.codegraph.storage.GraphStore;
import com.purchasingpower.codegraph.storage.StorageLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Stores {@code graph.json} and a separate {@code metadata.json} so callers
 * can inspect scan statistics without reading the whole graph.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileGraphStore implements GraphStore {

    private final StorageLayout layout;
    private final ObjectMapper objectMapper;
    private final SourceFileDiscovery sourceFileDiscovery;

    @Override
    public void save(Path root, KnowledgeGraph graph) {
        Path graphFile = layout.graphFile(root);
        try {
            Files.createDirectories(layout.directory(root));
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(graphFile.toFile(), graph);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(layout.metadataFile(root).toFile(), graph.getMetadata());
            log.info("💾 Saved graph with {} nodes to {}", graph.getNodes().size(), graphFile);
        } catch (IOException e) {
            throw new GraphStorageException(graphFile, "Failed to save graph", e);
        }
    }

    @Override
    public Optional<KnowledgeGraph> load(Path root) {
        Path graphFile = layout.graphFile(root);
        if (!Files.isRegularFile(graphFile)) {
            return Optional.empty();
        }
        try {
            KnowledgeGraph graph = objectMapper.readValue(graphFile.toFile(), KnowledgeGraph.class);
            log.debug("📂 Loaded graph with {} nodes from {}", graph.getNodes().size(), graphFile);
            return Optional.of(graph);
        } catch (IOException e) {
            throw new GraphStorageException(graphFile, "Failed to load graph", e);
        }
    }

    @Override
    public Optional<GraphMetadata> loadMetadata(Path root) {
        Path metadataFile = layout.metadataFile(root);
        if (!Files.isRegularFile(metadataFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(metadataFile.toFile(), GraphMetadata.class));
        } catch (IOException e) {
            throw new GraphStorageException(metadataFile, "Failed to load graph metadata", e);
        }
    }

    @Override
    public boolean exists(Path root) {
        return Files.isRegularFile(layout.graphFile(root));
    }

    @Override
    public void delete(Path root) {
        try {
            Files.deleteIfExists(layout.graphFile(root));
            Files.deleteIfExists(layout.metadataFile(root));
        } catch (IOException e) {
            throw new GraphStorageException(layout.graphFile(root), "Failed to delete graph", e);
        }
    }

    @Override
    public boolean isGraphStale(Path root) {
        Optional<GraphMetadata> metadata = exists(root) ? loadMetadata(root) : Optional.empty();
        if (metadata.isEmpty() || metadata.get().getScannedAt() == null) {
            return true;
        }
        Instant scannedAt = metadata.get().getScannedAt();
        FileStatsCache fileStats = new FileStatsCache();
        for (String file : sourceFileDiscovery.discover(root)) {
            try {
                if (fileStats.stats(root.resolve(file)).lastModified().isAfter(scannedAt)) {
                    log.debug("🔍 {} changed after the last scan", file);
                    return true;
                }
            } catch (IOException e) {
                log.debug("⚠️ Cannot stat {}: {}", file, e.getMessage());
                return true;
            }
        }
        return false;
    }

    @Override
    public Path graphFile(Path root) {
        return layout.graphFile(root);
    }
}
