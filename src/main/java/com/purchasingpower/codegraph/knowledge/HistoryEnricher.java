package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.history.HistoryResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Mines version-control history for scanned files.
 *
 * @since 1.0.0
 */
public interface HistoryEnricher {

    /**
     * Collects last-modified time, commit count and contributors per file.
     * Returns {@link HistoryResult#notVersionControlled()} when the root is not
     * inside a repository. A file whose history cannot be read is skipped.
     *
     * @param root      scanned root
     * @param filePaths root-relative paths
     * @param progress  called with (completed, total) after each batch
     */
    HistoryResult enrich(Path root, List<String> filePaths, ProgressCallback progress);

    @FunctionalInterface
    interface ProgressCallback {
        void onProgress(int completed, int total);
    }
}
