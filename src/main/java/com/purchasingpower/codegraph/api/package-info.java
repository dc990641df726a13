/**
 * REST API layer: controllers and request/response DTOs.
 *
 * <ul>
 *   <li>{@code KnowledgeController} - scan, index, statistics and file relationships</li>
 *   <li>{@code SearchController} - keyword, semantic and hybrid search</li>
 * </ul>
 *
 * <p>A missing graph maps to 404; semantic search without a usable index maps to 409.
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.api;
