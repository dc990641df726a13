package com.purchasingpower.codegraph.search.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.core.SearchMode;
import com.purchasingpower.codegraph.core.SearchResult;
import com.purchasingpower.codegraph.core.impl.SearchResultImpl;
import com.purchasingpower.codegraph.exception.IndexNotFoundException;
import com.purchasingpower.codegraph.model.embedding.EmbeddingIndex;
import com.purchasingpower.codegraph.model.graph.EdgeKind;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.search.KeywordMatcher;
import com.purchasingpower.codegraph.search.QueryExpander;
import com.purchasingpower.codegraph.search.ResultContextFormatter;
import com.purchasingpower.codegraph.search.SearchOptions;
import com.purchasingpower.codegraph.search.SearchOutcome;
import com.purchasingpower.codegraph.search.SearchService;
import com.purchasingpower.codegraph.search.SemanticRanker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default implementation of SearchService.
 *
 * <p>Semantic relevance is the similarity as a rounded percentage. Hybrid
 * search merges keyword and semantic hits by node id; a node found both ways
 * scores {@code min(100, max(keyword, semantic) + 10)}.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchServiceImpl implements SearchService {

    private static final int MAX_SUGGESTIONS = 3;
    private static final int BOTH_MODES_BOOST = 10;
    private static final Comparator<SearchResult> BY_RELEVANCE = Comparator
        .comparingInt(SearchResult::getRelevance).reversed()
        .thenComparing(SearchResult::getName, String.CASE_INSENSITIVE_ORDER);

    private final SemanticRanker semanticRanker;

    @Override
    public SearchOutcome search(String query, KnowledgeGraph graph, EmbeddingIndex index, SearchOptions options) {
        Preconditions.checkNotNull(graph, "graph must not be null");
        Preconditions.checkArgument(options.getLimit() > 0, "limit must be positive");
        long start = System.currentTimeMillis();
        SearchMode requested = options.getMode() != null ? options.getMode() : SearchMode.HYBRID;
        int limit = options.getLimit();
        log.info("🔍 Searching '{}' ({} mode, limit {})", query, requested, limit);

        SearchMode used = requested;
        List<SearchResult> results;
        switch (requested) {
            case KEYWORD -> results = keywordSearch(query, graph);
            case SEMANTIC -> results = semanticSearch(query, graph, index, limit);
            case HYBRID -> {
                if (index == null) {
                    log.debug("No embedding index available, falling back to keyword search");
                    used = SearchMode.KEYWORD;
                    results = keywordSearch(query, graph);
                } else {
                    results = hybridSearch(query, graph, index, limit);
                }
            }
            default -> throw new IllegalArgumentException("Unsupported search mode: " + requested);
        }

        List<SearchResult> limited = results.stream().limit(limit).collect(Collectors.toList());
        return SearchOutcome.builder()
            .query(query)
            .mode(used)
            .results(limited)
            .totalMatches(limited.size())
            .searchTimeMs(System.currentTimeMillis() - start)
            .suggestions(suggestions(query, limited))
            .build();
    }

    @Override
    public List<SearchResult> keywordSearch(String query, KnowledgeGraph graph) {
        List<String> keywords = QueryExpander.expand(query);
        if (keywords.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> importedBy = new HashMap<>();
        for (GraphEdge edge : graph.getEdges()) {
            if (edge.getType() == EdgeKind.IMPORTS) {
                importedBy.merge(edge.getTarget(), 1, Integer::sum);
            }
        }

        List<SearchResult> results = new ArrayList<>();
        for (GraphNode node : graph.getNodes().values()) {
            KeywordMatcher.Match match = KeywordMatcher.match(node, keywords, importedBy.getOrDefault(node.getId(), 0));
            if (match.score() > 0) {
                results.add(toResult(node, match.score(), null, match.reason()));
            }
        }
        results.sort(BY_RELEVANCE);
        return results;
    }

    @Override
    public List<SearchResult> semanticSearch(String query, KnowledgeGraph graph, EmbeddingIndex index, int limit) {
        if (index == null) {
            String root = graph.getMetadata() != null ? graph.getMetadata().getRootDir() : "unknown root";
            throw new IndexNotFoundException(root);
        }
        List<SearchResult> results = new ArrayList<>();
        for (SemanticRanker.ScoredChunk scored : semanticRanker.rank(query, index, candidateCount(limit))) {
            GraphNode node = graph.getNodes().get(scored.chunk().getId());
            if (node == null) {
                continue;
            }
            int relevance = (int) Math.round(scored.similarity() * 100);
            results.add(toResult(node, relevance, scored.similarity(), "Semantic similarity: " + relevance + "%"));
        }
        results.sort(BY_RELEVANCE);
        return results.stream().limit(limit).collect(Collectors.toList());
    }

    private List<SearchResult> hybridSearch(String query, KnowledgeGraph graph, EmbeddingIndex index, int limit) {
        Map<String, SearchResult> merged = new LinkedHashMap<>();
        for (SearchResult keywordHit : keywordSearch(query, graph)) {
            merged.put(keywordHit.getNodeId(), keywordHit);
        }
        for (SearchResult semanticHit : semanticSearch(query, graph, index, candidateCount(limit))) {
            SearchResult existing = merged.get(semanticHit.getNodeId());
            if (existing == null) {
                merged.put(semanticHit.getNodeId(), semanticHit);
                continue;
            }
            int boosted = Math.min(KeywordMatcher.MAX_RELEVANCE,
                Math.max(existing.getRelevance(), semanticHit.getRelevance()) + BOTH_MODES_BOOST);
            merged.put(existing.getNodeId(), ((SearchResultImpl) existing).toBuilder()
                .relevance(boosted)
                .similarity(semanticHit.getSimilarity())
                .matchReason(existing.getMatchReason() + " + Semantic match")
                .build());
        }
        List<SearchResult> results = new ArrayList<>(merged.values());
        results.sort(BY_RELEVANCE);
        return results;
    }

    /** Twice the limit, saturating at {@code Integer.MAX_VALUE}. */
    static int candidateCount(int limit) {
        return (int) Math.min(Integer.MAX_VALUE, 2L * limit);
    }

    private static SearchResult toResult(GraphNode node, int relevance, Double similarity, String reason) {
        return SearchResultImpl.builder()
            .nodeId(node.getId())
            .kind(node.getKind())
            .name(node.getName())
            .filePath(node.getFilePath())
            .line(node.getLineStart())
            .relevance(relevance)
            .similarity(similarity)
            .context(ResultContextFormatter.describe(node))
            .matchReason(reason)
            .build();
    }

    static List<String> suggestions(String query, List<SearchResult> results) {
        List<String> suggestions = new ArrayList<>();
        if (results.isEmpty()) {
            suggestions.add("Try broader terms like \"util\", \"handler\", or \"service\"");
            suggestions.add("Search for specific kinds with \"controller\", \"model\", or \"test\"");
        } else if (results.size() > 50) {
            suggestions.add("Add more specific terms to narrow results");
            Set<String> kinds = results.stream()
                .map(result -> result.getKind().getValue())
                .collect(Collectors.toCollection(LinkedHashSet::new));
            if (kinds.size() > 1) {
                suggestions.add("Filter by type: " + kinds.stream().limit(3).collect(Collectors.joining(", ")));
            }
        } else {
            SearchResult top = results.get(0);
            String kind = top.getKind().getValue();
            if (!"file".equals(kind)) {
                String path = top.getFilePath();
                suggestions.add("Explore file: \"" + path.substring(path.lastIndexOf('/') + 1) + "\"");
            }
            if (!query.toLowerCase(Locale.ROOT).contains(kind)) {
                suggestions.add("Search \"" + query + " " + kind + "\"");
            }
        }
        return suggestions.stream().limit(MAX_SUGGESTIONS).collect(Collectors.toList());
    }
}
