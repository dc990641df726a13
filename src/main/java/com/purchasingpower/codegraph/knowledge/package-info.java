/**
 * Knowledge graph construction: symbol extraction, import resolution,
 * history enrichment and the build orchestration around them.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code SymbolExtractor} - one parsed file to a file node and its symbols</li>
 *   <li>{@code RelationshipResolver} - imports and supertypes to directed edges</li>
 *   <li>{@code HistoryEnricher} - last change, change count and contributors from git</li>
 *   <li>{@code GraphBuildService} - runs the phases and collects errors and warnings</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.knowledge;
