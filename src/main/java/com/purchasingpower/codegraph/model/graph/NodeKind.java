package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kind tag of a graph node, serialized in lower case.
 *
 * @since 1.0.0
 */
public enum NodeKind {
    FILE("file"),
    FUNCTION("function"),
    CLASS("class"),
    INTERFACE("interface"),
    TYPE("type"),
    VARIABLE("variable"),
    ENUM("enum");

    private final String value;

    NodeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static NodeKind fromValue(String value) {
        return Arrays.stream(values())
            .filter(kind -> kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown node kind: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
