package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.exception.SourceParseException;

import java.nio.file.Path;

/**
 * Language front end: turns one file into a parsed handle.
 *
 * @since 1.0.0
 */
public interface SourceParser {

    boolean supports(String relativePath);

    /**
     * Reads and parses one file.
     *
     * @param root         scanned root
     * @param relativePath root-relative path as returned by discovery
     * @param fileStats    cache of the current scan session
     * @throws SourceParseException if the file cannot be read or has syntax errors
     */
    ParsedSourceFile parse(Path root, String relativePath, FileStatsCache fileStats);
}
