package com.purchasingpower.codegraph.embedding;

import com.purchasingpower.codegraph.model.embedding.EmbeddingIndex;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;

/**
 * Builds TF-IDF embedding indexes from graph snapshots.
 *
 * @since 1.0.0
 */
public interface EmbeddingIndexService {

    /**
     * Builds one chunk per graph node with an L2-normalized TF-IDF vector over
     * the sorted vocabulary of all chunk documents.
     */
    EmbeddingIndex buildIndex(KnowledgeGraph graph);

    /**
     * Embeds free text against the index's fixed vocabulary and IDF weights.
     * Terms outside the vocabulary contribute nothing.
     */
    double[] embed(String text, EmbeddingIndex index);
}
