package com.purchasingpower.codegraph.analysis;

/**
 * Complexity bands: low up to 5, medium up to 10, high up to 20, very high above.
 */
public enum ComplexityCategory {
    LOW("🟢"),
    MEDIUM("🟡"),
    HIGH("🟠"),
    VERY_HIGH("🔴");

    public static final int LOW_THRESHOLD = 5;
    public static final int MEDIUM_THRESHOLD = 10;
    public static final int HIGH_THRESHOLD = 20;

    private final String indicator;

    ComplexityCategory(String indicator) {
        this.indicator = indicator;
    }

    public String getIndicator() {
        return indicator;
    }

    public static ComplexityCategory of(int complexity) {
        if (complexity <= LOW_THRESHOLD) return LOW;
        if (complexity <= MEDIUM_THRESHOLD) return MEDIUM;
        if (complexity <= HIGH_THRESHOLD) return HIGH;
        return VERY_HIGH;
    }
}
