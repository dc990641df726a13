package com.purchasingpower.codegraph.model.ast;

import com.purchasingpower.codegraph.model.graph.FileNode;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything extracted from one source file: its file node, the symbol nodes
 * in declaration order and the raw material for relationship resolution.
 */
@Value
@Builder
public class FileExtraction {

    FileNode fileNode;
    List<GraphNode> symbols;
    String packageName;
    List<ImportReference> imports;
    List<DeclaredType> declaredTypes;

    public String getFilePath() {
        return fileNode.getFilePath();
    }
}
