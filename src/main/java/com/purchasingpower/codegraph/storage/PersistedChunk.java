package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.model.graph.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * On-disk form of a chunk; {@code embedding} holds {@code [index, value]} pairs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersistedChunk {

    private String id;
    private String filePath;
    private NodeKind type;
    private String name;
    private String content;
    private int startLine;
    private int endLine;
    private List<List<Number>> embedding;
}
