package com.purchasingpower.codegraph.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Thrown when a persisted artifact cannot be written, read or removed.
 */
@Getter
public class GraphStorageException extends CodeGraphException {

    private final Path location;

    public GraphStorageException(Path location, String message, Throwable cause) {
        super(message + ": " + location, cause);
        this.location = location;
    }
}
