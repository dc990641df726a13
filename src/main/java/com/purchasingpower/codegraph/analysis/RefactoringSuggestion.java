package com.purchasingpower.codegraph.analysis;

public record RefactoringSuggestion(ComplexityHotspot target, String reason, Priority priority) {

    public enum Priority {
        HIGH,
        MEDIUM,
        LOW
    }
}
