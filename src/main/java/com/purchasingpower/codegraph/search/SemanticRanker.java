package com.purchasingpower.codegraph.search;

import com.purchasingpower.codegraph.embedding.EmbeddingIndexService;
import com.purchasingpower.codegraph.embedding.VectorMath;
import com.purchasingpower.codegraph.model.embedding.CodeChunk;
import com.purchasingpower.codegraph.model.embedding.EmbeddingIndex;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ranks index chunks by cosine similarity to a query.
 */
@Component
@RequiredArgsConstructor
public class SemanticRanker {

    private final EmbeddingIndexService embeddingIndexService;

    /**
     * Chunks with similarity above zero, best first, at most {@code limit}.
     */
    public List<ScoredChunk> rank(String query, EmbeddingIndex index, int limit) {
        double[] queryVector = embeddingIndexService.embed(query, index);
        return index.getChunks().stream()
            .map(chunk -> new ScoredChunk(chunk, VectorMath.cosineSimilarity(queryVector, chunk.getEmbedding())))
            .filter(scored -> scored.similarity() > 0)
            .sorted(Comparator.comparingDouble(ScoredChunk::similarity).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    public record ScoredChunk(CodeChunk chunk, double similarity) {
    }
}
