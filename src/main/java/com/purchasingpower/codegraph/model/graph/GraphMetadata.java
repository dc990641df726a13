package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.codegraph.model.history.RepositoryStats;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Scan statistics of one snapshot. Computed only from what the scan actually collected.
 * {@code repository} is present only when history was collected from a git work tree.
 */
@Value
@Builder
@Jacksonized
public class GraphMetadata {

    Instant scannedAt;
    long scanDurationMs;
    String rootDir;
    int fileCount;
    long totalLines;
    Map<String, Integer> languages;
    int nodeCount;
    int edgeCount;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    RepositoryStats repository;
}
