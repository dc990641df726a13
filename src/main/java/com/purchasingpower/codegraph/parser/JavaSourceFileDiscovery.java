package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.ScanProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a directory tree collecting {@code *.java} files, skipping excluded
 * directories, {@code package-info.java} and {@code module-info.java}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JavaSourceFileDiscovery implements SourceFileDiscovery {

    private static final Set<String> NON_TYPE_FILES = Set.of("package-info.java", "module-info.java");
    private static final String TEST_SOURCES = "src/test/";

    private final CodeGraphProperties properties;

    @Override
    public List<String> discover(Path root) {
        ScanProperties scan = properties.getScan();
        Set<String> excluded = new HashSet<>(scan.getExcludedDirectories());
        excluded.add(properties.getStorage().getDirectory());
        List<String> files = new ArrayList<>();

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && excluded.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String fileName = file.getFileName().toString();
                    if (attrs.isRegularFile() && fileName.endsWith(".java") && !NON_TYPE_FILES.contains(fileName)) {
                        String relative = toRelativePath(root, file);
                        if (scan.isIncludeTestSources() || !isTestSource(relative)) {
                            files.add(relative);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("⚠️ Cannot read {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }

        Collections.sort(files);
        log.debug("🔍 Discovered {} Java files under {}", files.size(), root);
        return files;
    }

    static String toRelativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static boolean isTestSource(String relativePath) {
        return relativePath.startsWith(TEST_SOURCES) || relativePath.contains("/" + TEST_SOURCES);
    }
}
