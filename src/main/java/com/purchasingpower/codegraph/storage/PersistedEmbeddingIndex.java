package com.purchasingpower.codegraph.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersistedEmbeddingIndex {

    private List<PersistedChunk> chunks;
    private List<String> vocabulary;
    private double[] idf;
    private String version;
    private Instant createdAt;
    private int chunkCount;
    private int vocabularySize;
}
