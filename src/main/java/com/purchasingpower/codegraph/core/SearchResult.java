package com.purchasingpower.codegraph.core;

import com.purchasingpower.codegraph.model.graph.NodeKind;

/**
 * One ranked match from any search mode.
 *
 * @since 1.0.0
 */
public interface SearchResult {

    /**
     * Id of the matched graph node (and of its index chunk).
     */
    String getNodeId();

    NodeKind getKind();

    String getName();

    String getFilePath();

    /**
     * First line of the matched declaration.
     */
    int getLine();

    /**
     * Relevance from 0 to 100. Semantic matches use the rounded similarity percentage.
     */
    int getRelevance();

    /**
     * Raw cosine similarity, present only for matches found through the index.
     */
    Double getSimilarity();

    /**
     * Short signature or documentation excerpt describing the match.
     */
    String getContext();

    /**
     * Why this result matched, e.g. {@code Name starts with: "user"}.
     */
    String getMatchReason();
}
