package com.purchasingpower.codegraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Build embedding index response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexResponse {

    private boolean success;
    private int chunkCount;
    private int vocabularySize;
    private long durationMs;
    private String error;

    public static IndexResponse success(int chunkCount, int vocabularySize, long durationMs) {
        return IndexResponse.builder()
            .success(true)
            .chunkCount(chunkCount)
            .vocabularySize(vocabularySize)
            .durationMs(durationMs)
            .build();
    }

    public static IndexResponse error(String error) {
        return IndexResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
