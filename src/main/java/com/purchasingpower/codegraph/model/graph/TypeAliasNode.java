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
 * Record or annotation-type declaration ({@code form} is {@code record} or {@code annotation}).
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@Jacksonized
@SuperBuilder(toBuilder = true)
public class TypeAliasNode extends GraphNode {

    public static final String RECORD = "record";
    public static final String ANNOTATION = "annotation";

    private final String form;
    @Builder.Default
    private final List<String> components = List.of();
    @Builder.Default
    private final List<String> interfaces = List.of();

    @Override
    public NodeKind getKind() {
        return NodeKind.TYPE;
    }

    @Override
    public TypeAliasNode withHistory(Instant lastModified, int modificationCount, List<String> contributors) {
        return toBuilder()
            .lastModified(lastModified)
            .modificationCount(modificationCount)
            .contributors(List.copyOf(contributors))
            .build();
    }
}
