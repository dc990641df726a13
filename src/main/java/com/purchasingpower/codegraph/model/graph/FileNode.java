package com.purchasingpower.codegraph.model.graph;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@Jacksonized
@SuperBuilder(toBuilder = true)
public class FileNode extends GraphNode {

    private final String language;
    private final int lineCount;
    private final int importCount;
    private final int exportCount;
    private final int dependencyCount;
    private final int dependentCount;

    @Override
    public NodeKind getKind() {
        return NodeKind.FILE;
    }

    @Override
    public FileNode withHistory(Instant lastModified, int modificationCount, List<String> contributors) {
        return toBuilder()
            .lastModified(lastModified)
            .modificationCount(modificationCount)
            .contributors(List.copyOf(contributors))
            .build();
    }

    public FileNode withDependencyCounts(int dependencies, int dependents) {
        return toBuilder()
            .dependencyCount(dependencies)
            .dependentCount(dependents)
            .build();
    }
}
