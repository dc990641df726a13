package com.purchasingpower.codegraph.model.build;

/**
 * Receives build progress. Called from the thread running the build.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (phase, completed, total, currentFile) -> { };

    void onProgress(BuildPhase phase, int completed, int total, String currentFile);
}
