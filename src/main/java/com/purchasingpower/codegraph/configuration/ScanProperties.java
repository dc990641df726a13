package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ScanProperties {

    /** Overall scan deadline. */
    @Positive
    private long timeoutMs = 300_000;

    /** Deadline for extracting a single file, measured from when a worker picks it up. */
    @Positive
    private long fileTimeoutMs = 10_000;

    @Min(1)
    private int workerThreads = 4;

    private boolean includeHistory = true;

    private boolean includeTestSources = false;

    @Positive
    private long maxFileSizeBytes = 1_048_576;

    @NotNull
    private List<String> excludedDirectories = new ArrayList<>(List.of(
        ".git", ".idea", ".codegraph", "target", "build", "out", "node_modules"));
}
