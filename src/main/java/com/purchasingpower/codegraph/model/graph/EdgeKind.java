package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Relationship type of a graph edge, serialized in lower case.
 *
 * @since 1.0.0
 */
public enum EdgeKind {
    IMPORTS("imports"),
    EXPORTS("exports"),
    CALLS("calls"),
    EXTENDS("extends"),
    IMPLEMENTS("implements"),
    USES("uses"),
    CONTAINS("contains");

    private final String value;

    EdgeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EdgeKind fromValue(String value) {
        return Arrays.stream(values())
            .filter(kind -> kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown edge kind: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
