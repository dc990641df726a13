package com.purchasingpower.codegraph.analysis;

import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ComplexityHotspot {

    String nodeId;
    String filePath;
    String name;
    NodeKind kind;
    int complexity;
    int lineStart;
    int lineEnd;

    public static ComplexityHotspot of(GraphNode node) {
        return ComplexityHotspot.builder()
            .nodeId(node.getId())
            .filePath(node.getFilePath())
            .name(node.getName())
            .kind(node.getKind())
            .complexity(node.getComplexity())
            .lineStart(node.getLineStart())
            .lineEnd(node.getLineEnd())
            .build();
    }

    public ComplexityCategory getCategory() {
        return ComplexityCategory.of(complexity);
    }
}
