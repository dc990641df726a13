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
public class EnumNode extends GraphNode {

    @Builder.Default
    private final List<String> constants = List.of();
    @Builder.Default
    private final List<String> interfaces = List.of();

    @Override
    public NodeKind getKind() {
        return NodeKind.ENUM;
    }

    @Override
    public EnumNode withHistory(Instant lastModified, int modificationCount, List<String> contributors) {
        return toBuilder()
            .lastModified(lastModified)
            .modificationCount(modificationCount)
            .contributors(List.copyOf(contributors))
            .build();
    }
}
