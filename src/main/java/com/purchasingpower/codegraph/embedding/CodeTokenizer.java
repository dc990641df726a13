package com.purchasingpower.codegraph.embedding;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits identifiers and prose into lower-case search terms.
 *
 * <p>{@code parseHTTPRequest} becomes {@code parse, http, request}; tokens of
 * one character are dropped. Indexing and querying share this pipeline.
 */
public final class CodeTokenizer {

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z])([A-Z][a-z])");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private CodeTokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String separated = CAMEL_BOUNDARY.matcher(text).replaceAll("$1 $2");
        separated = ACRONYM_BOUNDARY.matcher(separated).replaceAll("$1 $2");
        return Arrays.stream(NON_ALPHANUMERIC.split(separated.toLowerCase(Locale.ROOT)))
            .filter(token -> token.length() > 1)
            .collect(Collectors.toList());
    }
}
