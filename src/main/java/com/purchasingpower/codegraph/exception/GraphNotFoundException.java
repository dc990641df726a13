package com.purchasingpower.codegraph.exception;

import lombok.Getter;

/**
 * Thrown when an operation needs a persisted graph and none exists yet.
 */
@Getter
public class GraphNotFoundException extends CodeGraphException {

    private final String rootPath;

    public GraphNotFoundException(String rootPath) {
        super("No knowledge graph found for " + rootPath + ". Run a scan first.");
        this.rootPath = rootPath;
    }
}
