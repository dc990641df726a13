package com.purchasingpower.codegraph.model.build;

import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import lombok.Value;

import java.util.List;

/**
 * A built graph plus everything that went wrong while building it. Errors and
 * warnings are kept apart so callers can inspect each severity on its own.
 *
 * @since 1.0.0
 */
@Value
public class BuildResult {

    KnowledgeGraph graph;
    List<ScanError> errors;
    List<ScanWarning> warnings;

    public static BuildResult of(KnowledgeGraph graph, List<ScanError> errors, List<ScanWarning> warnings) {
        return new BuildResult(graph, List.copyOf(errors), List.copyOf(warnings));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<ScanError> errorsOfScope(ErrorScope scope) {
        return errors.stream().filter(error -> error.scope() == scope).toList();
    }
}
