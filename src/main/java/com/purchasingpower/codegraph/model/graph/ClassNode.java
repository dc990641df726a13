package com.purchasingpower.codegraph.model.graph;

import lombok.Builder;
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
public class ClassNode extends GraphNode {

    private final boolean abstractClass;
    private final String superclass;
    @Builder.Default
    private final List<String> interfaces = List.of();
    private final int memberCount;

    @Override
    public NodeKind getKind() {
        return NodeKind.CLASS;
    }

    @Override
    public ClassNode withHistory(Instant lastModified, int modificationCount, List<String> contributors) {
        return toBuilder()
            .lastModified(lastModified)
            .modificationCount(modificationCount)
            .contributors(List.copyOf(contributors))
            .build();
    }
}
