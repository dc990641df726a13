package com.purchasingpower.codegraph.model.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Imports, importers and exported symbols of one file.
 * {@code connectivity} is {@code min(1, connections / 20)} rounded to two decimals.
 */
@Value
@Builder
public class FileRelationships {

    String filePath;
    boolean exists;
    List<ImportLink> imports;
    List<ImportLink> importedBy;
    List<ExportedSymbol> exports;
    double connectivity;
    String summary;

    /**
     * @param filePath the other file
     * @param symbols  imported names, {@code *} for wildcards
     */
    public record ImportLink(String filePath, List<String> symbols) {
    }

    public record ExportedSymbol(String name, NodeKind kind, int lineStart) {
    }
}
