package com.purchasingpower.codegraph.parser;

import com.github.javaparser.ast.CompilationUnit;
import lombok.Value;

@Value
public class ParsedSourceFile {

    String relativePath;
    String language;
    int lineCount;
    CompilationUnit compilationUnit;
}
