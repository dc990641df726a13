package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.model.embedding.EmbeddingIndex;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists embedding indexes in sparse form.
 *
 * @since 1.0.0
 */
public interface EmbeddingIndexStore {

    void save(Path root, EmbeddingIndex index);

    /**
     * Loads the stored index, restoring dense vectors.
     */
    Optional<EmbeddingIndex> load(Path root);

    boolean exists(Path root);

    void delete(Path root);

    /**
     * True when the graph file or the index file is missing, or the graph
     * file was modified after the index file.
     */
    boolean isStale(Path root);
}
