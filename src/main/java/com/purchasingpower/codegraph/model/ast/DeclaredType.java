package com.purchasingpower.codegraph.model.ast;

import com.purchasingpower.codegraph.model.graph.NodeKind;

import java.util.List;

/**
 * A type declared in a scanned file, with its super types as written.
 *
 * @param nodeId        id of the node created for the type
 * @param kind          node kind of the type
 * @param filePath      declaring file
 * @param packageName   package of the file, empty for the default package
 * @param name          name inside the package, {@code Outer.Inner} for nested types
 * @param topLevel      declared directly in the compilation unit
 * @param extendsTypes  names after {@code extends}
 * @param implementsTypes names after {@code implements}
 */
public record DeclaredType(
    String nodeId,
    NodeKind kind,
    String filePath,
    String packageName,
    String name,
    boolean topLevel,
    List<String> extendsTypes,
    List<String> implementsTypes
) {

    public String qualifiedName() {
        return packageName.isEmpty() ? name : packageName + "." + name;
    }

    public String simpleName() {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }
}
