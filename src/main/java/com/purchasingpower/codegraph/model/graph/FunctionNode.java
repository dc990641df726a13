package com.purchasingpower.codegraph.model.graph;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A method, named {@code Owner.method}. The return type is the declared text, never resolved.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@Jacksonized
@SuperBuilder(toBuilder = true)
public class FunctionNode extends GraphNode {

    @Builder.Default
    private final List<String> parameters = List.of();
    private final String returnType;
    private final boolean async;
    private final boolean generator;

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION;
    }

    @Override
    public FunctionNode withHistory(Instant lastModified, int modificationCount, List<String> contributors) {
        return toBuilder()
            .lastModified(lastModified)
            .modificationCount(modificationCount)
            .contributors(List.copyOf(contributors))
            .build();
    }
}
