package com.purchasingpower.codegraph.exception;

/**
 * Base exception for knowledge graph failures.
 *
 * <p>Recoverable scan problems are reported as data on the build result;
 * exceptions are reserved for conditions the caller has to act on.
 *
 * @since 1.0.0
 */
public class CodeGraphException extends RuntimeException {

    public CodeGraphException(String message) {
        super(message);
    }

    public CodeGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
