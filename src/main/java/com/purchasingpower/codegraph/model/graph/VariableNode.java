package com.purchasingpower.codegraph.model.graph;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A {@code public static} field or interface constant, named {@code Owner.FIELD}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@Jacksonized
@SuperBuilder(toBuilder = true)
public class VariableNode extends GraphNode {

    private final String declaredType;
    private final boolean constant;

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIABLE;
    }

    @Override
    public VariableNode withHistory(Instant lastModified, int modificationCount, List<String> contributors) {
        return toBuilder()
            .lastModified(lastModified)
            .modificationCount(modificationCount)
            .contributors(List.copyOf(contributors))
            .build();
    }
}
