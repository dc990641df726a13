package com.purchasingpower.codegraph.search;

import com.purchasingpower.codegraph.model.graph.GraphNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores a node against expanded query keywords.
 *
 * <p>Per keyword the best of: exact name 100, name prefix 85, name suffix 80,
 * name substring 70, path substring 50. A match earns +5 when exported, and
 * +10 when more than three imports target the node (+5 for at least one),
 * capped at 100.
 */
public final class KeywordMatcher {

    static final int EXACT = 100;
    static final int PREFIX = 85;
    static final int SUFFIX = 80;
    static final int CONTAINS = 70;
    static final int PATH = 50;
    public static final int MAX_RELEVANCE = 100;

    private KeywordMatcher() {
    }

    public static Match match(GraphNode node, List<String> keywords, int importedBy) {
        String name = node.getName().toLowerCase(Locale.ROOT);
        String path = node.getFilePath().toLowerCase(Locale.ROOT);
        int score = 0;
        List<String> reasons = new ArrayList<>();

        for (String keyword : keywords) {
            if (name.equals(keyword)) {
                score = Math.max(score, EXACT);
                reasons.add("Exact name match: \"" + keyword + "\"");
            } else if (name.startsWith(keyword)) {
                score = Math.max(score, PREFIX);
                reasons.add("Name starts with: \"" + keyword + "\"");
            } else if (name.endsWith(keyword)) {
                score = Math.max(score, SUFFIX);
                reasons.add("Name ends with: \"" + keyword + "\"");
            } else if (name.contains(keyword)) {
                score = Math.max(score, CONTAINS);
                reasons.add("Name contains: \"" + keyword + "\"");
            } else if (path.contains(keyword)) {
                score = Math.max(score, PATH);
                reasons.add("Path contains: \"" + keyword + "\"");
            }
        }

        if (score > 0) {
            if (node.isExported()) {
                score = Math.min(MAX_RELEVANCE, score + 5);
                reasons.add("Exported symbol");
            }
            if (importedBy > 3) {
                score = Math.min(MAX_RELEVANCE, score + 10);
                reasons.add("Used by " + importedBy + " files");
            } else if (importedBy > 0) {
                score = Math.min(MAX_RELEVANCE, score + 5);
            }
        }
        return new Match(score, reasons.isEmpty() ? "Related match" : reasons.get(0));
    }

    public record Match(int score, String reason) {
    }
}
