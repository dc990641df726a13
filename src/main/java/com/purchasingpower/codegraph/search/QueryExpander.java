package com.purchasingpower.codegraph.search;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Splits a free-text query into keywords and expands them with synonyms of
 * common development terms.
 */
public final class QueryExpander {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s,._\\-/]+");

    private static final Map<String, List<String>> SYNONYMS = Map.ofEntries(
        // Authentication
        entry("user", List.of("user", "auth", "account", "profile", "member")),
        entry("auth", List.of("auth", "authentication", "login", "session", "token", "jwt", "oauth")),
        entry("login", List.of("login", "signin", "sign-in", "authenticate", "auth")),
        entry("session", List.of("session", "cookie", "token", "auth")),

        // API
        entry("api", List.of("api", "route", "handler", "endpoint", "controller", "rest")),
        entry("endpoint", List.of("endpoint", "route", "handler", "api", "controller")),
        entry("handler", List.of("handler", "controller", "route", "endpoint", "action")),
        entry("route", List.of("route", "router", "path", "endpoint", "api")),

        // Persistence
        entry("database", List.of("db", "database", "model", "schema", "entity", "repository", "store")),
        entry("model", List.of("model", "schema", "entity", "type", "interface", "dto")),
        entry("schema", List.of("schema", "model", "entity", "definition", "type")),
        entry("entity", List.of("entity", "model", "record", "row", "document")),
        entry("repository", List.of("repository", "dao", "store", "persistence")),

        // Data
        entry("data", List.of("data", "store", "state", "cache", "storage")),
        entry("store", List.of("store", "state", "storage", "cache", "repository")),
        entry("cache", List.of("cache", "memo", "store", "buffer")),

        // Presentation
        entry("component", List.of("component", "widget", "element", "ui", "view")),
        entry("ui", List.of("ui", "component", "view", "interface", "display")),
        entry("view", List.of("view", "page", "screen", "template", "component")),
        entry("page", List.of("page", "view", "screen", "route")),

        // Testing
        entry("test", List.of("test", "spec", "mock", "fixture", "assert")),
        entry("mock", List.of("mock", "stub", "fake", "spy", "test")),

        // Utilities
        entry("util", List.of("util", "utils", "helper", "helpers", "common", "shared")),
        entry("helper", List.of("helper", "helpers", "util", "utils", "tool")),

        // Configuration
        entry("config", List.of("config", "configuration", "settings", "options", "properties", "env")),
        entry("settings", List.of("settings", "config", "preferences", "options")),

        // Types
        entry("type", List.of("type", "types", "interface", "interfaces", "definition")),
        entry("interface", List.of("interface", "interfaces", "type", "types", "contract")),

        // Errors
        entry("error", List.of("error", "exception", "throw", "catch", "handle")),
        entry("exception", List.of("exception", "error", "throw", "catch")),

        // Events
        entry("hook", List.of("hook", "hooks", "event", "listener", "callback")),
        entry("event", List.of("event", "listener", "handler", "emit", "subscribe")),

        // Services
        entry("service", List.of("service", "provider", "manager", "controller")),
        entry("provider", List.of("provider", "service", "factory", "builder")),

        entry("state", List.of("state", "store", "context", "atom")),

        // Analysis
        entry("graph", List.of("graph", "node", "edge", "tree", "network")),
        entry("analysis", List.of("analysis", "analyzer", "parse", "inspect", "examine"))
    );

    private QueryExpander() {
    }

    /**
     * Lower-cased query words longer than one character, each followed by its
     * synonyms: the entry keyed by the word and every entry listing it.
     */
    public static List<String> expand(String query) {
        Set<String> expanded = new LinkedHashSet<>();
        if (query == null) {
            return List.of();
        }
        for (String word : SEPARATORS.split(query.toLowerCase(Locale.ROOT).trim())) {
            if (word.length() <= 1) {
                continue;
            }
            expanded.add(word);
            List<String> direct = SYNONYMS.get(word);
            if (direct != null) {
                expanded.addAll(direct);
            }
            // Map.ofEntries iteration order varies between runs; sort for stable output
            SYNONYMS.keySet().stream()
                .sorted()
                .map(SYNONYMS::get)
                .filter(synonyms -> synonyms.contains(word))
                .forEach(expanded::addAll);
        }
        return List.copyOf(expanded);
    }
}
