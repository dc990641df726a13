package com.purchasingpower.codegraph.exception;

import lombok.Getter;

/**
 * Thrown when a single source file cannot be read or parsed.
 */
@Getter
public class SourceParseException extends CodeGraphException {

    private final String filePath;

    public SourceParseException(String filePath, String message) {
        super(message);
        this.filePath = filePath;
    }

    public SourceParseException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }
}
