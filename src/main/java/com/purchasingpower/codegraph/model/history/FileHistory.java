package com.purchasingpower.codegraph.model.history;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Version-control history of one file. {@code commitCount} is bounded by the
 * configured per-file commit limit.
 */
@Value
@Builder
public class FileHistory {

    String filePath;
    Instant lastModified;
    int commitCount;
    List<String> contributors;
}
