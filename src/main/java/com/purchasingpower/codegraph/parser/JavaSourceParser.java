package com.purchasingpower.codegraph.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.SourceParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JavaParser front end. No symbol solver is configured, so nothing is ever resolved.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JavaSourceParser implements SourceParser {

    public static final String LANGUAGE = "java";

    private final CodeGraphProperties properties;

    @Override
    public boolean supports(String relativePath) {
        return relativePath.endsWith(".java");
    }

    @Override
    public ParsedSourceFile parse(Path root, String relativePath, FileStatsCache fileStats) {
        Path file = root.resolve(relativePath);
        String content = read(file, relativePath, fileStats);

        // JavaParser instances are not thread-safe; one per file
        JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result = parser.parse(content);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problem = result.getProblems().stream()
                .findFirst()
                .map(Problem::getVerboseMessage)
                .orElse("unknown syntax error");
            throw new SourceParseException(relativePath, "Parse failed for " + relativePath + ": " + problem);
        }

        int lineCount = (int) content.lines().count();
        log.debug("📄 Parsed {} ({} lines)", relativePath, lineCount);
        return new ParsedSourceFile(relativePath, LANGUAGE, lineCount, result.getResult().get());
    }

    private String read(Path file, String relativePath, FileStatsCache fileStats) {
        try {
            long size = fileStats.stats(file).sizeBytes();
            long limit = properties.getScan().getMaxFileSizeBytes();
            if (size > limit) {
                throw new SourceParseException(relativePath,
                    String.format("File too large (%d bytes, limit %d)", size, limit));
            }
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (CharacterCodingException e) {
                log.debug("⚠️ {} is not UTF-8, reading as ISO-8859-1", relativePath);
                return Files.readString(file, StandardCharsets.ISO_8859_1);
            }
        } catch (IOException e) {
            throw new SourceParseException(relativePath, "Cannot read " + relativePath + ": " + e.getMessage(), e);
        }
    }
}
