package com.purchasingpower.codegraph.analysis;

import com.purchasingpower.codegraph.model.graph.FileNode;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Change-frequency views over the history recorded on file nodes.
 *
 * <p>Files scanned without history have no modification count and never
 * qualify as hot.
 */
@Slf4j
@Component
public class ChurnAnalyzer {

    public static final int DEFAULT_HOT_FILE_THRESHOLD = 10;

    static final int COMMIT_SATURATION = 50;
    static final int CONTRIBUTOR_SATURATION = 5;
    static final long RECENCY_WINDOW_DAYS = 180;

    private static final double COMMIT_WEIGHT = 0.4;
    private static final double CONTRIBUTOR_WEIGHT = 0.3;
    private static final double RECENCY_WEIGHT = 0.3;

    private static final Comparator<FileChurn> MOST_MODIFIED = Comparator
        .comparingInt(FileChurn::getModificationCount).reversed()
        .thenComparing(FileChurn::getFilePath);

    public List<FileChurn> findHotFiles(KnowledgeGraph graph, Instant now) {
        return findHotFiles(graph, DEFAULT_HOT_FILE_THRESHOLD, now);
    }

    /**
     * Files modified in at least {@code threshold} commits, most modified first.
     */
    public List<FileChurn> findHotFiles(KnowledgeGraph graph, int threshold, Instant now) {
        List<FileChurn> hot = graph.nodesOfType(FileNode.class).stream()
            .filter(file -> file.getModificationCount() != null && file.getModificationCount() >= threshold)
            .map(file -> churnOf(file, now))
            .sorted(MOST_MODIFIED)
            .collect(Collectors.toList());
        log.debug("🔥 {} hot files at threshold {}", hot.size(), threshold);
        return hot;
    }

    public FileChurn churnOf(GraphNode file, Instant now) {
        return FileChurn.builder()
            .filePath(file.getFilePath())
            .modificationCount(modifications(file))
            .contributorCount(contributors(file))
            .lastModified(file.getLastModified())
            .churnScore(churnScore(file, now))
            .build();
    }

    /**
     * Weighted sum of commit volume (saturating at 50), contributor count
     * (saturating at 5) and recency (fading to zero over 180 days).
     */
    public double churnScore(GraphNode file, Instant now) {
        double commitFactor = Math.min(1.0, (double) modifications(file) / COMMIT_SATURATION);
        double contributorFactor = Math.min(1.0, (double) contributors(file) / CONTRIBUTOR_SATURATION);
        return commitFactor * COMMIT_WEIGHT
            + contributorFactor * CONTRIBUTOR_WEIGHT
            + recency(file.getLastModified(), now) * RECENCY_WEIGHT;
    }

    static double recency(Instant lastModified, Instant now) {
        if (lastModified == null) {
            return 0;
        }
        double days = Duration.between(lastModified, now).toMillis() / (double) Duration.ofDays(1).toMillis();
        return Math.max(0, Math.min(1, 1 - days / RECENCY_WINDOW_DAYS));
    }

    private static int modifications(GraphNode file) {
        return file.getModificationCount() != null ? file.getModificationCount() : 0;
    }

    private static int contributors(GraphNode file) {
        return file.getContributors() != null ? file.getContributors().size() : 0;
    }
}
