package com.purchasingpower.codegraph.service.graph;

import com.purchasingpower.codegraph.model.graph.FileRelationships;
import com.purchasingpower.codegraph.model.graph.ImpactAnalysisReport;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;

import java.util.List;

/**
 * Service for traversing the file import graph of a snapshot.
 * Every method takes file ids (root-relative paths).
 */
public interface GraphTraversalService {

    /**
     * Files imported directly by the given file, sorted.
     */
    List<String> findDirectDependencies(KnowledgeGraph graph, String filePath);

    /**
     * All files reachable through imports within {@code maxDepth} hops, sorted.
     */
    List<String> findAllDependencies(KnowledgeGraph graph, String filePath, int maxDepth);

    /**
     * Files importing the given file directly, sorted.
     */
    List<String> findDirectDependents(KnowledgeGraph graph, String filePath);

    /**
     * All files that reach the given file through imports within {@code maxDepth} hops, sorted.
     */
    List<String> findAllDependents(KnowledgeGraph graph, String filePath, int maxDepth);

    /**
     * Find shortest import path between two files.
     * Returns null if no path exists.
     *
     * @param maxDepth maximum number of files on the path
     * @return path as string (e.g. {@code "A->B->C"}) or null
     */
    String findShortestPath(KnowledgeGraph graph, String startFile, String endFile, int maxDepth);

    /**
     * Risk of changing a file: dependents up to three import hops away,
     * its highest symbol complexity and its commit activity.
     */
    ImpactAnalysisReport analyzeImpact(KnowledgeGraph graph, String filePath);

    FileRelationships getFileRelationships(KnowledgeGraph graph, String filePath);

    /**
     * Coupling between two files, 0 to 1: 0.3 for each direct import
     * direction, plus 0.05 per shared dependency and per shared importer
     * (each capped at 0.2).
     */
    double calculateCouplingScore(KnowledgeGraph graph, String fileA, String fileB);
}
