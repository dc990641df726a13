/**
 * The knowledge graph model: one node class per symbol kind, typed edges and
 * the immutable {@link com.purchasingpower.codegraph.model.graph.KnowledgeGraph} snapshot.
 */
package com.purchasingpower.codegraph.model.graph;
