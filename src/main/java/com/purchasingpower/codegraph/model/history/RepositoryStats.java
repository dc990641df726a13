package com.purchasingpower.codegraph.model.history;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Repository-wide commit totals, reported on the graph metadata.
 */
@Value
@Builder
@Jacksonized
public class RepositoryStats {

    int totalCommits;
    int contributorCount;
    Instant firstCommit;
    Instant lastCommit;

    public static RepositoryStats empty() {
        return RepositoryStats.builder().build();
    }
}
