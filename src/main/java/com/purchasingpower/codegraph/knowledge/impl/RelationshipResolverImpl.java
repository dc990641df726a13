package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.knowledge.RelationshipResolver;
import com.purchasingpower.codegraph.knowledge.ResolvedRelationships;
import com.purchasingpower.codegraph.model.ast.DeclaredType;
import com.purchasingpower.codegraph.model.ast.FileExtraction;
import com.purchasingpower.codegraph.model.ast.ImportReference;
import com.purchasingpower.codegraph.model.graph.EdgeKind;
import com.purchasingpower.codegraph.model.graph.GraphEdge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Resolves Java imports through an index of every scanned type's fully
 * qualified name. Single-type and static imports point at the declaring
 * file, package wildcards expand to every file of the package. Anything
 * not declared in the scanned files (JDK, libraries) is dropped.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class RelationshipResolverImpl implements RelationshipResolver {

    private static final String WILDCARD = "*";

    @Override
    public ResolvedRelationships resolve(List<FileExtraction> extractions) {
        List<FileExtraction> ordered = new ArrayList<>(extractions);
        ordered.sort(Comparator.comparing(FileExtraction::getFilePath));
        TypeIndex index = new TypeIndex(ordered);

        List<GraphEdge> edges = new ArrayList<>();
        Map<String, Set<String>> dependencies = new TreeMap<>();
        Map<String, Set<String>> dependents = new TreeMap<>();

        int importSeq = 0;
        int dropped = 0;
        for (FileExtraction extraction : ordered) {
            String sourcePath = extraction.getFilePath();
            for (ImportReference ref : extraction.getImports()) {
                List<String> targets = resolveImport(ref, index);
                if (targets.isEmpty()) {
                    dropped++;
                }
                for (String target : targets) {
                    if (target.equals(sourcePath)) {
                        continue;
                    }
                    edges.add(GraphEdge.builder()
                        .id("import-" + importSeq++)
                        .source(sourcePath)
                        .target(target)
                        .type(EdgeKind.IMPORTS)
                        .metadata(importMetadata(ref))
                        .build());
                    dependencies.computeIfAbsent(sourcePath, k -> new TreeSet<>()).add(target);
                    dependents.computeIfAbsent(target, k -> new TreeSet<>()).add(sourcePath);
                }
            }
        }

        int extendsSeq = 0;
        int implementsSeq = 0;
        for (FileExtraction extraction : ordered) {
            for (DeclaredType type : extraction.getDeclaredTypes()) {
                for (String name : type.extendsTypes()) {
                    Optional<DeclaredType> target = resolveTypeReference(name, extraction, index)
                        .filter(found -> !found.nodeId().equals(type.nodeId()));
                    if (target.isPresent()) {
                        edges.add(superTypeEdge("extends-" + extendsSeq++, type, target.get(), EdgeKind.EXTENDS));
                    }
                }
                for (String name : type.implementsTypes()) {
                    Optional<DeclaredType> target = resolveTypeReference(name, extraction, index);
                    if (target.isPresent()) {
                        edges.add(superTypeEdge("implements-" + implementsSeq++, type, target.get(), EdgeKind.IMPLEMENTS));
                    }
                }
            }
        }

        log.debug("🔗 Resolved {} import edges, {} extends, {} implements ({} external imports dropped)",
            importSeq, extendsSeq, implementsSeq, dropped);
        return new ResolvedRelationships(
            List.copyOf(edges),
            Collections.unmodifiableMap(dependencies),
            Collections.unmodifiableMap(dependents));
    }

    private List<String> resolveImport(ImportReference ref, TypeIndex index) {
        if (ref.isStatic()) {
            // import static a.b.C.member / a.b.C.*
            String owner = ref.wildcard() ? ref.name() : ref.qualifier();
            return index.type(owner).map(type -> List.of(type.filePath())).orElse(List.of());
        }
        Optional<DeclaredType> type = index.type(ref.name());
        if (type.isPresent()) {
            return List.of(type.get().filePath());
        }
        if (ref.wildcard()) {
            return index.filesInPackage(ref.name());
        }
        return List.of();
    }

    private static Map<String, Object> importMetadata(ImportReference ref) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(GraphEdge.SYMBOLS, List.of(ref.wildcard() ? WILDCARD : ref.lastSegment()));
        metadata.put(GraphEdge.IS_STATIC, ref.isStatic());
        metadata.put(GraphEdge.IS_WILDCARD, ref.wildcard());
        return Collections.unmodifiableMap(metadata);
    }

    private static GraphEdge superTypeEdge(String id, DeclaredType source, DeclaredType target, EdgeKind kind) {
        return GraphEdge.builder()
            .id(id)
            .source(source.nodeId())
            .target(target.nodeId())
            .type(kind)
            .build();
    }

    /**
     * Resolves a type name as written in an {@code extends}/{@code implements}
     * clause: fully qualified, or a simple name looked up in the same file,
     * the single-type imports, the same package and the wildcard imports.
     */
    private Optional<DeclaredType> resolveTypeReference(String name, FileExtraction extraction, TypeIndex index) {
        Optional<DeclaredType> qualified = index.type(name);
        if (qualified.isPresent()) {
            return qualified;
        }
        int dot = name.indexOf('.');
        String head = dot < 0 ? name : name.substring(0, dot);
        String tail = dot < 0 ? "" : name.substring(dot);
        return resolveSimpleName(head, extraction, index)
            .flatMap(found -> tail.isEmpty() ? Optional.of(found) : index.type(found.qualifiedName() + tail));
    }

    private Optional<DeclaredType> resolveSimpleName(String simpleName, FileExtraction extraction, TypeIndex index) {
        for (DeclaredType local : extraction.getDeclaredTypes()) {
            if (local.simpleName().equals(simpleName)) {
                return Optional.of(local);
            }
        }
        for (ImportReference ref : extraction.getImports()) {
            if (!ref.isStatic() && !ref.wildcard() && ref.lastSegment().equals(simpleName)) {
                Optional<DeclaredType> imported = index.type(ref.name());
                if (imported.isPresent()) {
                    return imported;
                }
            }
        }
        String samePackage = extraction.getPackageName().isEmpty()
            ? simpleName
            : extraction.getPackageName() + "." + simpleName;
        Optional<DeclaredType> sibling = index.type(samePackage);
        if (sibling.isPresent()) {
            return sibling;
        }
        for (ImportReference ref : extraction.getImports()) {
            if (!ref.isStatic() && ref.wildcard()) {
                Optional<DeclaredType> onDemand = index.type(ref.name() + "." + simpleName);
                if (onDemand.isPresent()) {
                    return onDemand;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Every scanned type by fully qualified name, and the files declaring
     * top-level types per package. The first declaration in path order wins.
     */
    private static final class TypeIndex {
        private final Map<String, DeclaredType> byQualifiedName = new LinkedHashMap<>();
        private final Map<String, Set<String>> filesByPackage = new TreeMap<>();

        private TypeIndex(List<FileExtraction> ordered) {
            for (FileExtraction extraction : ordered) {
                for (DeclaredType type : extraction.getDeclaredTypes()) {
                    byQualifiedName.putIfAbsent(type.qualifiedName(), type);
                    if (type.topLevel()) {
                        filesByPackage.computeIfAbsent(type.packageName(), k -> new TreeSet<>()).add(type.filePath());
                    }
                }
            }
        }

        private Optional<DeclaredType> type(String qualifiedName) {
            return Optional.ofNullable(byQualifiedName.get(qualifiedName));
        }

        private List<String> filesInPackage(String packageName) {
            return List.copyOf(filesByPackage.getOrDefault(packageName, Set.of()));
        }
    }
}
