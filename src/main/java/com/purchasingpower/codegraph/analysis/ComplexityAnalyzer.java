package com.purchasingpower.codegraph.analysis;

import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Complexity views over a knowledge graph snapshot.
 *
 * <p>Only nodes carrying a complexity score take part. File nodes hold the sum
 * of their symbols, so they are skipped everywhere except hotspot listings that
 * ask for them and the per-directory totals.
 */
@Slf4j
@Component
public class ComplexityAnalyzer {

    public static final int DEFAULT_HOTSPOT_LIMIT = 10;
    public static final int REPORT_HOTSPOT_LIMIT = 20;
    private static final int LONG_SYMBOL_LINES = 50;

    private static final Comparator<ComplexityHotspot> BY_COMPLEXITY =
        Comparator.comparingInt(ComplexityHotspot::getComplexity).reversed()
            .thenComparing(ComplexityHotspot::getFilePath)
            .thenComparingInt(ComplexityHotspot::getLineStart);

    public List<ComplexityHotspot> findHotspots(KnowledgeGraph graph) {
        return findHotspots(graph, DEFAULT_HOTSPOT_LIMIT, ComplexityCategory.MEDIUM_THRESHOLD, false);
    }

    /**
     * Nodes whose complexity is at least {@code threshold}, most complex first.
     */
    public List<ComplexityHotspot> findHotspots(KnowledgeGraph graph, int limit, int threshold, boolean includeFiles) {
        return graph.getNodes().values().stream()
            .filter(node -> node.getComplexity() != null && node.getComplexity() > 0)
            .filter(node -> node.getComplexity() >= threshold)
            .filter(node -> includeFiles || node.getKind() != NodeKind.FILE)
            .map(ComplexityHotspot::of)
            .sorted(BY_COMPLEXITY)
            .limit(limit)
            .collect(Collectors.toList());
    }

    public ComplexityReport generateReport(KnowledgeGraph graph) {
        List<Integer> scores = scoredSymbols(graph).stream()
            .map(GraphNode::getComplexity)
            .collect(Collectors.toList());

        Map<ComplexityCategory, Integer> distribution = new EnumMap<>(ComplexityCategory.class);
        for (ComplexityCategory category : ComplexityCategory.values()) {
            distribution.put(category, 0);
        }

        if (scores.isEmpty()) {
            return ComplexityReport.builder()
                .averageComplexity(0)
                .maxComplexity(0)
                .totalComplexity(0)
                .hotspots(List.of())
                .distribution(distribution)
                .build();
        }

        long total = 0;
        int max = 0;
        for (int score : scores) {
            total += score;
            max = Math.max(max, score);
            distribution.merge(ComplexityCategory.of(score), 1, Integer::sum);
        }

        ComplexityReport report = ComplexityReport.builder()
            .averageComplexity(Math.round((double) total / scores.size() * 100) / 100.0)
            .maxComplexity(max)
            .totalComplexity(total)
            .hotspots(findHotspots(graph, REPORT_HOTSPOT_LIMIT, ComplexityCategory.MEDIUM_THRESHOLD, false))
            .distribution(distribution)
            .build();
        log.debug("Complexity report: {} symbols, average {}, max {} {}",
            scores.size(), report.getAverageComplexity(), max, ComplexityCategory.of(max).getIndicator());
        return report;
    }

    /**
     * Compares every node id present in both snapshots with a score on each side.
     */
    public ComplexityComparison compare(KnowledgeGraph before, KnowledgeGraph after) {
        List<ComplexityHotspot> improved = new ArrayList<>();
        List<ComplexityHotspot> worsened = new ArrayList<>();
        int unchanged = 0;

        for (GraphNode afterNode : after.getNodes().values()) {
            GraphNode beforeNode = before.getNodes().get(afterNode.getId());
            if (beforeNode == null || !isScored(afterNode) || !isScored(beforeNode)) continue;

            int diff = afterNode.getComplexity() - beforeNode.getComplexity();
            if (diff > 0) {
                worsened.add(ComplexityHotspot.of(afterNode));
            } else if (diff < 0) {
                improved.add(ComplexityHotspot.of(afterNode));
            } else {
                unchanged++;
            }
        }
        return new ComplexityComparison(improved, worsened, unchanged);
    }

    /**
     * File complexity totals per directory, sorted by directory.
     */
    public List<DirectoryComplexity> complexityByDirectory(KnowledgeGraph graph) {
        Map<String, long[]> totals = new TreeMap<>();
        for (GraphNode node : graph.getNodes().values()) {
            if (node.getKind() != NodeKind.FILE || !isScored(node)) continue;

            long[] entry = totals.computeIfAbsent(directoryOf(node.getFilePath()), dir -> new long[2]);
            entry[0] += node.getComplexity();
            entry[1]++;
        }

        return totals.entrySet().stream()
            .map(e -> new DirectoryComplexity(
                e.getKey(),
                e.getValue()[0],
                (int) e.getValue()[1],
                Math.round((double) e.getValue()[0] / e.getValue()[1] * 100) / 100.0))
            .collect(Collectors.toList());
    }

    /**
     * Refactoring candidates, high priority first. A long symbol of moderate
     * complexity can appear twice: once for its score and once for its length.
     */
    public List<RefactoringSuggestion> suggestRefactoringTargets(KnowledgeGraph graph) {
        List<RefactoringSuggestion> suggestions = new ArrayList<>();

        for (GraphNode node : scoredSymbols(graph)) {
            int complexity = node.getComplexity();
            ComplexityHotspot target = ComplexityHotspot.of(node);

            if (complexity > ComplexityCategory.HIGH_THRESHOLD) {
                suggestions.add(new RefactoringSuggestion(target,
                    "Cyclomatic complexity of " + complexity + " is very high. Consider breaking it into smaller methods.",
                    RefactoringSuggestion.Priority.HIGH));
            } else if (complexity > ComplexityCategory.MEDIUM_THRESHOLD) {
                suggestions.add(new RefactoringSuggestion(target,
                    "Cyclomatic complexity of " + complexity + " is above the recommended threshold.",
                    RefactoringSuggestion.Priority.MEDIUM));
            }

            int lineCount = node.getLineEnd() - node.getLineStart();
            if (lineCount > LONG_SYMBOL_LINES && complexity > ComplexityCategory.LOW_THRESHOLD) {
                suggestions.add(new RefactoringSuggestion(target,
                    "Spans " + lineCount + " lines. Consider extracting helper methods.",
                    RefactoringSuggestion.Priority.MEDIUM));
            }
        }

        suggestions.sort(Comparator.comparing(RefactoringSuggestion::priority));
        return suggestions;
    }

    private static List<GraphNode> scoredSymbols(KnowledgeGraph graph) {
        return graph.getNodes().values().stream()
            .filter(node -> node.getKind() != NodeKind.FILE)
            .filter(ComplexityAnalyzer::isScored)
            .collect(Collectors.toList());
    }

    private static boolean isScored(GraphNode node) {
        return node.getComplexity() != null && node.getComplexity() > 0;
    }

    static String directoryOf(String filePath) {
        int slash = filePath.lastIndexOf('/');
        return slash > 0 ? filePath.substring(0, slash) : ".";
    }
}
