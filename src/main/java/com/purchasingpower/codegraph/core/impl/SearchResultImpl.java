package com.purchasingpower.codegraph.core.impl;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.codegraph.core.SearchResult;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Default implementation of SearchResult.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResultImpl implements SearchResult {

    private String nodeId;
    private NodeKind kind;
    private String name;
    private String filePath;
    private int line;
    private int relevance;
    private Double similarity;
    private String context;
    private String matchReason;
}
