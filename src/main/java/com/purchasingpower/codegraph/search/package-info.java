/**
 * Search over a knowledge graph: keyword matching with synonym expansion,
 * cosine ranking against the embedding index, and the hybrid of both.
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.search;
