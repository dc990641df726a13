package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.model.graph.GraphMetadata;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists graph snapshots under the scanned root.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    void save(Path root, KnowledgeGraph graph);

    Optional<KnowledgeGraph> load(Path root);

    Optional<GraphMetadata> loadMetadata(Path root);

    boolean exists(Path root);

    void delete(Path root);

    /**
     * True when no graph is stored or any source file changed after the stored scan.
     */
    boolean isGraphStale(Path root);

    Path graphFile(Path root);
}
