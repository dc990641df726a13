package com.purchasingpower.codegraph.search;

import com.purchasingpower.codegraph.core.SearchResult;
import com.purchasingpower.codegraph.exception.IndexNotFoundException;
import com.purchasingpower.codegraph.model.embedding.EmbeddingIndex;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;

import java.util.List;

/**
 * Unified search over a knowledge graph and its embedding index.
 *
 * <ul>
 *   <li>Keyword: name and path matching against graph nodes, no index needed</li>
 *   <li>Semantic: cosine ranking against the embedding index</li>
 *   <li>Hybrid: both, merged by node id; keyword only when there is no index</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface SearchService {

    /**
     * Search in the mode named by the options.
     *
     * @param index embedding index, or {@code null} when none is available
     * @throws IndexNotFoundException if semantic mode is requested without an index
     */
    SearchOutcome search(String query, KnowledgeGraph graph, EmbeddingIndex index, SearchOptions options);

    /**
     * All keyword matches, best first.
     */
    List<SearchResult> keywordSearch(String query, KnowledgeGraph graph);

    /**
     * Chunks with positive similarity to the query, best first, at most {@code limit}.
     * A query made only of unknown terms yields an empty list.
     */
    List<SearchResult> semanticSearch(String query, KnowledgeGraph graph, EmbeddingIndex index, int limit);
}
