package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.model.build.BuildResult;
import com.purchasingpower.codegraph.model.build.ScanError;
import com.purchasingpower.codegraph.model.build.ScanWarning;
import com.purchasingpower.codegraph.model.graph.GraphMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Scan repository response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResponse {

    private boolean success;
    private String error;
    private String rootPath;
    private int fileCount;
    private int nodeCount;
    private int edgeCount;
    private long durationMs;

    @Builder.Default
    private List<ScanError> errors = new ArrayList<>();

    @Builder.Default
    private List<ScanWarning> warnings = new ArrayList<>();

    public static ScanResponse success(BuildResult result) {
        GraphMetadata metadata = result.getGraph().getMetadata();
        return ScanResponse.builder()
            .success(true)
            .rootPath(metadata.getRootDir())
            .fileCount(metadata.getFileCount())
            .nodeCount(metadata.getNodeCount())
            .edgeCount(metadata.getEdgeCount())
            .durationMs(metadata.getScanDurationMs())
            .errors(result.getErrors())
            .warnings(result.getWarnings())
            .build();
    }

    public static ScanResponse error(String error) {
        return ScanResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
