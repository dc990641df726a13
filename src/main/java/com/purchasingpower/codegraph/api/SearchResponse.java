package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.search.SearchOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Search response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    private boolean success;
    private String error;
    private String query;
    private String mode;
    private int totalMatches;
    private long searchTimeMs;

    @Builder.Default
    private List<Result> results = new ArrayList<>();

    @Builder.Default
    private List<String> suggestions = new ArrayList<>();

    public static SearchResponse success(SearchOutcome outcome) {
        return SearchResponse.builder()
            .success(true)
            .query(outcome.getQuery())
            .mode(outcome.getMode().name().toLowerCase())
            .totalMatches(outcome.getTotalMatches())
            .searchTimeMs(outcome.getSearchTimeMs())
            .results(outcome.getResults().stream()
                .map(r -> Result.builder()
                    .nodeId(r.getNodeId())
                    .type(r.getKind() != null ? r.getKind().getValue() : "unknown")
                    .name(r.getName())
                    .filePath(r.getFilePath())
                    .line(r.getLine())
                    .relevance(r.getRelevance())
                    .similarity(r.getSimilarity())
                    .context(r.getContext())
                    .matchReason(r.getMatchReason())
                    .build())
                .collect(Collectors.toList()))
            .suggestions(outcome.getSuggestions())
            .build();
    }

    public static SearchResponse error(String error) {
        return SearchResponse.builder()
            .success(false)
            .error(error)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Result {
        private String nodeId;
        private String type;
        private String name;
        private String filePath;
        private int line;
        private int relevance;
        private Double similarity;
        private String context;
        private String matchReason;
    }
}
