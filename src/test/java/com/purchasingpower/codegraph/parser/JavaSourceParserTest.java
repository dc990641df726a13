package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.SourceParseException;
import com.purchasingpower.codegraph.support.SourceFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Java Source Parser Tests")
class JavaSourceParserTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("Should parse modern syntax and count lines")
    void parsesJava17() throws Exception {
        FileStatsCache cache = new FileStatsCache();
        SourceFixtures.write(root, "Point.java", """
            package geo;

            public record Point(int x, int y) {
                public String describe(Object o) {
                    return o instanceof Point p ? "point " + p.x() : "other";
                }
            }
            """);

        ParsedSourceFile parsed = new JavaSourceParser(new CodeGraphProperties()).parse(root, "Point.java", cache);

        assertEquals("java", parsed.getLanguage());
        assertEquals(7, parsed.getLineCount());
        assertThat(parsed.getCompilationUnit().getTypes()).hasSize(1);
        // size was read once for the limit check and stays cached
        assertEquals(Files.size(root.resolve("Point.java")), cache.stats(root.resolve("Point.java")).sizeBytes());
    }

    @Test
    @DisplayName("Should reject files with syntax errors")
    void rejectsSyntaxErrors() {
        SourceFixtures.write(root, "Broken.java", "class Broken { void x( }");

        assertThatThrownBy(() -> new JavaSourceParser(new CodeGraphProperties())
                .parse(root, "Broken.java", new FileStatsCache()))
            .isInstanceOf(SourceParseException.class)
            .hasMessageStartingWith("Parse failed for Broken.java")
            .satisfies(e -> assertEquals("Broken.java", ((SourceParseException) e).getFilePath()));
    }

    @Test
    @DisplayName("Should reject files above the size limit")
    void rejectsOversizedFiles() {
        CodeGraphProperties properties = new CodeGraphProperties();
        properties.getScan().setMaxFileSizeBytes(10);
        SourceFixtures.write(root, "Big.java", "class Big { int a; int b; }");

        assertThatThrownBy(() -> new JavaSourceParser(properties).parse(root, "Big.java", new FileStatsCache()))
            .isInstanceOf(SourceParseException.class)
            .hasMessageContaining("File too large");
    }
}
