package com.purchasingpower.codegraph.model.embedding;

import com.purchasingpower.codegraph.model.graph.NodeKind;
import lombok.Builder;
import lombok.Value;

/**
 * The indexed unit of search: one synthesized document per graph node.
 * {@code embedding} is dense, L2-normalized and as long as the vocabulary.
 */
@Value
@Builder
public class CodeChunk {

    String id;
    String filePath;
    NodeKind kind;
    String name;
    String content;
    int startLine;
    int endLine;
    double[] embedding;
}
