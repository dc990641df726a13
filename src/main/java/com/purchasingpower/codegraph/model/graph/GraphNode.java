package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.List;

/**
 * Common fields of every node in a knowledge graph.
 *
 * <p>One concrete subclass exists per {@link NodeKind}; each carries only the
 * fields relevant to that kind. Nodes are immutable. History fields stay
 * {@code null} (and are omitted from JSON) until history enrichment runs.
 *
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
@SuperBuilder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FileNode.class, name = "file"),
    @JsonSubTypes.Type(value = FunctionNode.class, name = "function"),
    @JsonSubTypes.Type(value = ClassNode.class, name = "class"),
    @JsonSubTypes.Type(value = InterfaceNode.class, name = "interface"),
    @JsonSubTypes.Type(value = TypeAliasNode.class, name = "type"),
    @JsonSubTypes.Type(value = EnumNode.class, name = "enum"),
    @JsonSubTypes.Type(value = VariableNode.class, name = "variable")
})
public abstract class GraphNode {

    private final String id;
    private final String name;
    private final String filePath;
    private final int lineStart;
    private final int lineEnd;
    private final boolean exported;
    private final Integer complexity;
    private final String documentation;

    private final Instant lastModified;
    private final Integer modificationCount;
    private final List<String> contributors;

    @JsonIgnore
    public abstract NodeKind getKind();

    /**
     * Returns a copy carrying the given version-control history.
     */
    public abstract GraphNode withHistory(Instant lastModified, int modificationCount, List<String> contributors);

    public boolean hasHistory() {
        return lastModified != null || modificationCount != null || contributors != null;
    }

    /**
     * Id of a symbol node: {@code path:kind:name:line}. File nodes use the path alone.
     */
    public static String symbolId(String filePath, NodeKind kind, String name, int line) {
        return filePath + ":" + kind.getValue() + ":" + name + ":" + line;
    }
}
