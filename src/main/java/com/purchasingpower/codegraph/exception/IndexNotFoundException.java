package com.purchasingpower.codegraph.exception;

import lombok.Getter;

/**
 * Thrown when semantic search is requested explicitly but no usable
 * embedding index exists.
 */
@Getter
public class IndexNotFoundException extends CodeGraphException {

    private final String rootPath;

    public IndexNotFoundException(String rootPath) {
        super("No embedding index found for " + rootPath + ". Build the index before using semantic search.");
        this.rootPath = rootPath;
    }
}
