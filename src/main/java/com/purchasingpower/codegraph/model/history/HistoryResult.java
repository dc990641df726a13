package com.purchasingpower.codegraph.model.history;

import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Outcome of history enrichment. A directory outside version control is
 * reported with {@code versionControlled == false}, which is distinct from a
 * repository whose files simply have no history.
 */
@Value
public class HistoryResult {

    boolean versionControlled;
    Map<String, FileHistory> histories;
    RepositoryStats repositoryStats;

    public static HistoryResult notVersionControlled() {
        return new HistoryResult(false, Map.of(), RepositoryStats.empty());
    }

    public static HistoryResult of(Map<String, FileHistory> histories, RepositoryStats stats) {
        return new HistoryResult(true, Map.copyOf(histories), stats);
    }

    public Optional<FileHistory> historyOf(String filePath) {
        return Optional.ofNullable(histories.get(filePath));
    }
}
