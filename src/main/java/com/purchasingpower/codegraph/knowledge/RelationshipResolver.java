package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.ast.FileExtraction;

import java.util.List;

/**
 * Resolves imports and super types across the full set of extracted files.
 *
 * @since 1.0.0
 */
public interface RelationshipResolver {

    /**
     * Produces {@code imports}, {@code extends} and {@code implements} edges
     * plus the per-file dependency maps. Targets outside the scanned files are
     * dropped. The same input always yields the same edge list.
     */
    ResolvedRelationships resolve(List<FileExtraction> extractions);
}
