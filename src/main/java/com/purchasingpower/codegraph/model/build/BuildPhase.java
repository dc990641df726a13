package com.purchasingpower.codegraph.model.build;

/**
 * Linear phases of a graph build, reported to progress listeners.
 */
public enum BuildPhase {
    INITIALIZING("Initializing"),
    ANALYZING_AST("Analyzing AST"),
    RESOLVING_IMPORTS("Resolving imports"),
    ANALYZING_HISTORY("Analyzing git history"),
    COMPLETE("Complete");

    private final String label;

    BuildPhase(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
