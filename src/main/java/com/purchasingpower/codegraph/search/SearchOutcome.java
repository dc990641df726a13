package com.purchasingpower.codegraph.search;

import com.purchasingpower.codegraph.core.SearchMode;
import com.purchasingpower.codegraph.core.SearchResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ranked results of one query. {@code mode} is the mode actually used, which
 * is {@link SearchMode#KEYWORD} when hybrid search found no index.
 */
@Value
@Builder
public class SearchOutcome {

    String query;
    SearchMode mode;
    List<SearchResult> results;
    int totalMatches;
    long searchTimeMs;
    List<String> suggestions;
}
