package com.purchasingpower.codegraph.search;

import com.purchasingpower.codegraph.model.graph.ClassNode;
import com.purchasingpower.codegraph.model.graph.FileNode;
import com.purchasingpower.codegraph.model.graph.FunctionNode;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.VariableNode;

/**
 * One-line description of a matched node: documentation when present,
 * otherwise a signature-like summary.
 */
public final class ResultContextFormatter {

    private static final int MAX_DOCUMENTATION = 100;

    private ResultContextFormatter() {
    }

    public static String describe(GraphNode node) {
        String documentation = node.getDocumentation();
        if (documentation != null) {
            return documentation.length() > MAX_DOCUMENTATION
                ? documentation.substring(0, MAX_DOCUMENTATION) + "..."
                : documentation;
        }

        return switch (node.getKind()) {
            case FUNCTION -> {
                FunctionNode function = (FunctionNode) node;
                String returnType = function.getReturnType() != null ? function.getReturnType() + " " : "";
                String async = function.isAsync() ? "async " : "";
                yield async + returnType + node.getName() + "(" + String.join(", ", function.getParameters()) + ")";
            }
            case CLASS -> {
                ClassNode type = (ClassNode) node;
                String superclass = type.getSuperclass() != null ? " extends " + type.getSuperclass() : "";
                String members = type.getMemberCount() > 0 ? " (" + type.getMemberCount() + " members)" : "";
                yield "class " + node.getName() + superclass + members;
            }
            case INTERFACE, TYPE -> node.getKind().getValue() + " " + node.getName() + " definition";
            case ENUM -> "enum " + node.getName();
            case VARIABLE -> {
                VariableNode variable = (VariableNode) node;
                String type = variable.getDeclaredType() != null ? variable.getDeclaredType() + " " : "";
                yield "variable " + type + node.getName();
            }
            case FILE -> {
                FileNode file = (FileNode) node;
                String lines = file.getLineCount() > 0 ? file.getLineCount() + " lines" : "";
                String language = file.getLanguage() != null ? " (" + file.getLanguage() + ")" : "";
                yield "File: " + lines + language;
            }
        };
    }
}
