package com.purchasingpower.codegraph.knowledge.impl;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.purchasingpower.codegraph.knowledge.ComplexityCalculator;
import com.purchasingpower.codegraph.knowledge.SymbolExtractor;
import com.purchasingpower.codegraph.model.ast.DeclaredType;
import com.purchasingpower.codegraph.model.ast.FileExtraction;
import com.purchasingpower.codegraph.model.ast.ImportReference;
import com.purchasingpower.codegraph.model.graph.ClassNode;
import com.purchasingpower.codegraph.model.graph.EnumNode;
import com.purchasingpower.codegraph.model.graph.FileNode;
import com.purchasingpower.codegraph.model.graph.FunctionNode;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.InterfaceNode;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.model.graph.TypeAliasNode;
import com.purchasingpower.codegraph.model.graph.VariableNode;
import com.purchasingpower.codegraph.parser.ParsedSourceFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts graph nodes from a JavaParser compilation unit.
 *
 * <p>Classes, interfaces, enums, records and annotation types (nested ones
 * included, named {@code Outer.Inner}) become type nodes. Methods of classes,
 * enums and records become function nodes named {@code Owner.method}.
 * Only {@code public static} fields and interface constants become variable
 * nodes. Declared return types are taken as written; nothing is resolved.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class JavaSymbolExtractor implements SymbolExtractor {

    private static final Set<String> ASYNC_TYPES = Set.of(
        "CompletableFuture", "CompletionStage", "Future", "ListenableFuture", "Mono", "Flux");
    private static final Set<String> GENERATOR_TYPES = Set.of(
        "Stream", "IntStream", "LongStream", "DoubleStream", "Iterator", "Iterable", "Spliterator");

    @Override
    public FileExtraction extract(ParsedSourceFile source) {
        CompilationUnit cu = source.getCompilationUnit();
        String path = source.getRelativePath();
        String packageName = cu.getPackageDeclaration()
            .map(pd -> pd.getNameAsString())
            .orElse("");

        Extraction extraction = new Extraction(path, packageName);
        for (TypeDeclaration<?> type : cu.getTypes()) {
            visitType(type, null, true, false, extraction);
        }

        List<ImportReference> imports = cu.getImports().stream()
            .map(imp -> new ImportReference(path, imp.getNameAsString(), imp.isStatic(), imp.isAsterisk()))
            .collect(Collectors.toList());

        int exportCount = (int) cu.getTypes().stream().filter(TypeDeclaration::isPublic).count();
        int fileComplexity = extraction.symbols.stream()
            .map(GraphNode::getComplexity)
            .filter(Objects::nonNull)
            .mapToInt(Integer::intValue)
            .sum();

        FileNode fileNode = FileNode.builder()
            .id(path)
            .name(fileName(path))
            .filePath(path)
            .lineStart(1)
            .lineEnd(source.getLineCount())
            .exported(exportCount > 0)
            .complexity(fileComplexity)
            .documentation(cu.getTypes().stream().findFirst().map(this::documentationOf).orElse(null))
            .language(source.getLanguage())
            .lineCount(source.getLineCount())
            .importCount(imports.size())
            .exportCount(exportCount)
            .build();

        log.debug("✅ Extracted {} symbols from {} (complexity {})", extraction.symbols.size(), path, fileComplexity);
        return FileExtraction.builder()
            .fileNode(fileNode)
            .symbols(List.copyOf(extraction.symbols))
            .packageName(packageName)
            .imports(List.copyOf(imports))
            .declaredTypes(List.copyOf(extraction.declaredTypes))
            .build();
    }

    private void visitType(TypeDeclaration<?> type, String owner, boolean ownerExported,
                           boolean ownerIsInterface, Extraction extraction) {
        String name = owner == null ? type.getNameAsString() : owner + "." + type.getNameAsString();
        boolean exported = ownerExported && (type.isPublic() || ownerIsInterface);
        boolean interfaceLike = false;

        if (type instanceof ClassOrInterfaceDeclaration decl && decl.isInterface()) {
            interfaceLike = true;
            List<String> superInterfaces = typeNames(decl.getExtendedTypes());
            GraphNode node = InterfaceNode.builder()
                .id(GraphNode.symbolId(extraction.path, NodeKind.INTERFACE, name, beginLine(decl)))
                .name(name)
                .filePath(extraction.path)
                .lineStart(beginLine(decl))
                .lineEnd(endLine(decl))
                .exported(exported)
                .documentation(documentationOf(decl))
                .superInterfaces(superInterfaces)
                .memberCount(decl.getMembers().size())
                .build();
            extraction.addType(node, owner == null, superInterfaces, List.of());
        } else if (type instanceof ClassOrInterfaceDeclaration decl) {
            List<String> superclass = typeNames(decl.getExtendedTypes());
            List<String> interfaces = typeNames(decl.getImplementedTypes());
            GraphNode node = ClassNode.builder()
                .id(GraphNode.symbolId(extraction.path, NodeKind.CLASS, name, beginLine(decl)))
                .name(name)
                .filePath(extraction.path)
                .lineStart(beginLine(decl))
                .lineEnd(endLine(decl))
                .exported(exported)
                .complexity(ComplexityCalculator.calculate(decl))
                .documentation(documentationOf(decl))
                .abstractClass(decl.isAbstract())
                .superclass(superclass.isEmpty() ? null : superclass.get(0))
                .interfaces(interfaces)
                .memberCount(decl.getMembers().size())
                .build();
            extraction.addType(node, owner == null, superclass, interfaces);
        } else if (type instanceof EnumDeclaration decl) {
            List<String> interfaces = typeNames(decl.getImplementedTypes());
            GraphNode node = EnumNode.builder()
                .id(GraphNode.symbolId(extraction.path, NodeKind.ENUM, name, beginLine(decl)))
                .name(name)
                .filePath(extraction.path)
                .lineStart(beginLine(decl))
                .lineEnd(endLine(decl))
                .exported(exported)
                .documentation(documentationOf(decl))
                .constants(decl.getEntries().stream()
                    .map(EnumConstantDeclaration::getNameAsString)
                    .collect(Collectors.toList()))
                .interfaces(interfaces)
                .build();
            extraction.addType(node, owner == null, List.of(), interfaces);
        } else if (type instanceof RecordDeclaration decl) {
            List<String> interfaces = typeNames(decl.getImplementedTypes());
            GraphNode node = TypeAliasNode.builder()
                .id(GraphNode.symbolId(extraction.path, NodeKind.TYPE, name, beginLine(decl)))
                .name(name)
                .filePath(extraction.path)
                .lineStart(beginLine(decl))
                .lineEnd(endLine(decl))
                .exported(exported)
                .documentation(documentationOf(decl))
                .form(TypeAliasNode.RECORD)
                .components(decl.getParameters().stream()
                    .map(Parameter::getNameAsString)
                    .collect(Collectors.toList()))
                .interfaces(interfaces)
                .build();
            extraction.addType(node, owner == null, List.of(), interfaces);
        } else if (type instanceof AnnotationDeclaration decl) {
            interfaceLike = true;
            GraphNode node = TypeAliasNode.builder()
                .id(GraphNode.symbolId(extraction.path, NodeKind.TYPE, name, beginLine(decl)))
                .name(name)
                .filePath(extraction.path)
                .lineStart(beginLine(decl))
                .lineEnd(endLine(decl))
                .exported(exported)
                .documentation(documentationOf(decl))
                .form(TypeAliasNode.ANNOTATION)
                .build();
            extraction.addType(node, owner == null, List.of(), List.of());
        } else {
            log.debug("⏭️ Skipping unsupported declaration {} in {}", name, extraction.path);
            return;
        }

        if (!interfaceLike) {
            for (MethodDeclaration method : type.getMethods()) {
                extraction.symbols.add(functionNode(method, name, exported, extraction.path));
            }
        }
        for (FieldDeclaration field : type.getFields()) {
            addVariables(field, name, exported, interfaceLike, extraction);
        }
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof TypeDeclaration<?> nested) {
                visitType(nested, name, exported, interfaceLike, extraction);
            }
        }
    }

    private FunctionNode functionNode(MethodDeclaration method, String owner, boolean ownerExported, String path) {
        String name = owner + "." + method.getNameAsString();
        String simpleReturnType = simpleTypeName(method.getType());
        return FunctionNode.builder()
            .id(GraphNode.symbolId(path, NodeKind.FUNCTION, name, beginLine(method)))
            .name(name)
            .filePath(path)
            .lineStart(beginLine(method))
            .lineEnd(endLine(method))
            .exported(ownerExported && method.isPublic())
            .complexity(ComplexityCalculator.calculate(method))
            .documentation(documentationOf(method))
            .parameters(method.getParameters().stream()
                .map(Parameter::getNameAsString)
                .collect(Collectors.toList()))
            .returnType(method.getTypeAsString())
            .async(ASYNC_TYPES.contains(simpleReturnType) || method.isAnnotationPresent("Async"))
            .generator(GENERATOR_TYPES.contains(simpleReturnType))
            .build();
    }

    private void addVariables(FieldDeclaration field, String owner, boolean ownerExported,
                              boolean interfaceLike, Extraction extraction) {
        boolean exported = ownerExported && (interfaceLike || (field.isPublic() && field.isStatic()));
        if (!exported) {
            return;
        }
        for (VariableDeclarator variable : field.getVariables()) {
            String name = owner + "." + variable.getNameAsString();
            extraction.symbols.add(VariableNode.builder()
                .id(GraphNode.symbolId(extraction.path, NodeKind.VARIABLE, name, beginLine(variable)))
                .name(name)
                .filePath(extraction.path)
                .lineStart(beginLine(variable))
                .lineEnd(endLine(variable))
                .exported(true)
                .documentation(documentationOf(field))
                .declaredType(variable.getTypeAsString())
                .constant(interfaceLike || field.isFinal())
                .build());
        }
    }

    private String documentationOf(NodeWithJavadoc<?> node) {
        try {
            return node.getJavadoc()
                .map(javadoc -> javadoc.getDescription().toText().trim())
                .filter(text -> !text.isEmpty())
                .orElse(null);
        } catch (RuntimeException e) {
            // malformed Javadoc must not cost the whole file
            log.debug("⚠️ Unreadable Javadoc: {}", e.getMessage());
            return null;
        }
    }

    private static List<String> typeNames(List<ClassOrInterfaceType> types) {
        return types.stream()
            .map(ClassOrInterfaceType::getNameWithScope)
            .collect(Collectors.toList());
    }

    private static String simpleTypeName(Type type) {
        return type.isClassOrInterfaceType()
            ? type.asClassOrInterfaceType().getNameAsString()
            : type.asString();
    }

    private static int beginLine(Node node) {
        return node.getBegin().map(pos -> pos.line).orElse(0);
    }

    private static int endLine(Node node) {
        return node.getEnd().map(pos -> pos.line).orElse(0);
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    private static final class Extraction {
        private final String path;
        private final String packageName;
        private final List<GraphNode> symbols = new ArrayList<>();
        private final List<DeclaredType> declaredTypes = new ArrayList<>();

        private Extraction(String path, String packageName) {
            this.path = path;
            this.packageName = packageName;
        }

        private void addType(GraphNode node, boolean topLevel,
                             List<String> extendsTypes, List<String> implementsTypes) {
            symbols.add(node);
            declaredTypes.add(new DeclaredType(node.getId(), node.getKind(), path, packageName,
                node.getName(), topLevel, List.copyOf(extendsTypes), List.copyOf(implementsTypes)));
        }
    }
}
