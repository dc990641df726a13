package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.ast.FileExtraction;
import com.purchasingpower.codegraph.parser.ParsedSourceFile;

/**
 * Turns one parsed file into a file node plus its symbol nodes.
 *
 * @since 1.0.0
 */
public interface SymbolExtractor {

    /**
     * Extracts the file node, the symbol nodes in declaration order and the
     * imports and declared types needed to resolve relationships.
     * Any exception is the caller's to record; other files are unaffected.
     */
    FileExtraction extract(ParsedSourceFile source);
}
