package com.purchasingpower.codegraph.model.embedding;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * TF-IDF index derived from exactly one graph snapshot. {@code idf} is aligned
 * with the sorted {@code vocabulary}.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class EmbeddingIndex {

    public static final String CURRENT_VERSION = "1.0.0";

    List<CodeChunk> chunks;
    List<String> vocabulary;
    double[] idf;
    String version;
    Instant createdAt;

    /** Term to vocabulary position, built on first use and kept for later queries. */
    @Getter(lazy = true)
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final Map<String, Integer> termPositions = positionsOf(vocabulary);

    public int getChunkCount() {
        return chunks.size();
    }

    public int getVocabularySize() {
        return vocabulary.size();
    }

    /**
     * Maps each vocabulary term to its position.
     */
    public static Map<String, Integer> positionsOf(List<String> vocabulary) {
        Map<String, Integer> positions = new HashMap<>(vocabulary.size() * 2);
        for (int i = 0; i < vocabulary.size(); i++) {
            positions.put(vocabulary.get(i), i);
        }
        return positions;
    }
}
