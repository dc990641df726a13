package com.purchasingpower.codegraph.analysis;

/**
 * Summed file complexity of one directory ({@code .} for the scan root).
 */
public record DirectoryComplexity(String directory, long totalComplexity, int fileCount, double averageComplexity) {
}
