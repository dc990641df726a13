package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Directed, typed relationship between two node ids.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphEdge {

    public static final String SYMBOLS = "symbols";
    public static final String IS_STATIC = "isStatic";
    public static final String IS_WILDCARD = "isWildcard";

    String id;
    String source;
    String target;
    EdgeKind type;
    Double weight;
    Map<String, Object> metadata;
}
