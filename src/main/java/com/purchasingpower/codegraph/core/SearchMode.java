package com.purchasingpower.codegraph.core;

/**
 * How a query is matched against the repository.
 *
 * @since 1.0.0
 */
public enum SearchMode {
    /** Name and path matching against graph nodes; needs no index. */
    KEYWORD,
    /** Cosine ranking against the embedding index; fails when no index exists. */
    SEMANTIC,
    /** Semantic plus keyword, degrading to keyword when no index exists. */
    HYBRID
}
