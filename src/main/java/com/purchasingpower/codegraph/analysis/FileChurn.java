package com.purchasingpower.codegraph.analysis;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Change activity of one file. {@code churnScore} runs from 0 (quiet) to 1 (volatile).
 */
@Value
@Builder
public class FileChurn {

    String filePath;
    int modificationCount;
    int contributorCount;
    Instant lastModified;
    double churnScore;
}
