package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class StorageProperties {

    /** Directory, relative to the scanned root, holding the persisted artifacts. */
    @NotBlank
    private String directory = ".codegraph";

    @NotBlank
    private String graphFile = "graph.json";

    @NotBlank
    private String metadataFile = "metadata.json";

    @NotBlank
    private String indexFile = "embeddings.json";
}
