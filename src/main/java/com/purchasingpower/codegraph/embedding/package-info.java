/**
 * TF-IDF embedding index: chunk text synthesis, tokenization, vector math and
 * the sparse encoding used on disk.
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.embedding;
