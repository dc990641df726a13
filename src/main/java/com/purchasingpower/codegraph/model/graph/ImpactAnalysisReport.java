package com.purchasingpower.codegraph.model.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * What a change to one file is likely to touch, scored 0 to 100.
 *
 * <p>Dependents are files reaching the analyzed file through imports;
 * {@code indirectDependents} excludes the direct ones. A file missing from
 * the graph yields a report with {@code found == false} and a zero score.
 */
@Value
@Builder
@Jacksonized
public class ImpactAnalysisReport {

    private static final int LISTED_DEPENDENTS = 8;

    String analyzedFile;
    boolean found;

    List<String> directDependencies;
    List<String> transitiveDependencies;
    List<String> directDependents;
    List<String> indirectDependents;
    List<String> hubDependents;

    int maxComplexity;
    RiskFactors factors;
    int riskScore;
    RiskLevel riskLevel;
    List<String> recommendations;

    public enum RiskLevel {
        LOW, MEDIUM, HIGH, CRITICAL;

        public static RiskLevel of(int riskScore) {
            if (riskScore < 25) return LOW;
            if (riskScore < 50) return MEDIUM;
            if (riskScore < 75) return HIGH;
            return CRITICAL;
        }
    }

    /**
     * Component scores, each 0 to 100.
     */
    @Value
    @Builder
    @Jacksonized
    public static class RiskFactors {
        int dependencyScore;
        int complexityScore;
        int churnScore;
    }

    public static ImpactAnalysisReport notFound(String filePath) {
        return ImpactAnalysisReport.builder()
            .analyzedFile(filePath)
            .found(false)
            .directDependencies(List.of())
            .transitiveDependencies(List.of())
            .directDependents(List.of())
            .indirectDependents(List.of())
            .hubDependents(List.of())
            .factors(RiskFactors.builder().build())
            .riskLevel(RiskLevel.LOW)
            .recommendations(List.of())
            .build();
    }

    public String toMarkdown() {
        if (!found) {
            return "## Change impact: " + analyzedFile + "\n\nNot in the knowledge graph. Run a scan first.\n";
        }
        List<String> lines = new ArrayList<>();
        lines.add("## Change impact: " + analyzedFile);
        lines.add("");
        lines.add("Risk: " + riskLevel + " (" + riskScore + "/100)");
        lines.add("");
        lines.add("| Factor | Score | Basis |");
        lines.add("|--------|-------|-------|");
        lines.add("| Dependents | " + factors.getDependencyScore() + " | "
            + directDependents.size() + " direct, " + indirectDependents.size() + " indirect |");
        lines.add("| Complexity | " + factors.getComplexityScore() + " | highest symbol score " + maxComplexity + " |");
        lines.add("| Churn | " + factors.getChurnScore() + " | commits and contributors |");
        lines.add("");
        lines.add("Imports " + directDependencies.size() + " files directly, "
            + transitiveDependencies.size() + " through the whole chain.");

        if (!directDependents.isEmpty()) {
            lines.add("");
            lines.add("### Importing files");
            directDependents.stream().limit(LISTED_DEPENDENTS).forEach(dependent -> lines.add("- " + dependent));
            if (directDependents.size() > LISTED_DEPENDENTS) {
                lines.add("- and " + (directDependents.size() - LISTED_DEPENDENTS) + " more");
            }
        }
        if (!indirectDependents.isEmpty()) {
            lines.add("");
            lines.add(indirectDependents.size() + " more files reach it through other imports.");
        }

        lines.add("");
        lines.add("### Before changing it");
        recommendations.forEach(recommendation -> lines.add("- " + recommendation));
        return String.join("\n", lines) + "\n";
    }
}
