package com.purchasingpower.codegraph.model.ast;

/**
 * One import declaration as written in a source file.
 *
 * @param sourcePath root-relative path of the importing file
 * @param name       imported name without the trailing {@code .*}
 * @param isStatic   {@code import static}
 * @param wildcard   on-demand import ending in {@code .*}
 */
public record ImportReference(String sourcePath, String name, boolean isStatic, boolean wildcard) {

    public String lastSegment() {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    public String qualifier() {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(0, dot);
    }
}
