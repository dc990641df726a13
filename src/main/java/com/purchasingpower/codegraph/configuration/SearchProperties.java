package com.purchasingpower.codegraph.configuration;

import com.purchasingpower.codegraph.core.SearchMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SearchProperties {

    @NotNull
    private SearchMode defaultMode = SearchMode.HYBRID;

    @Min(1)
    @Max(500)
    private int defaultLimit = 20;

    /** Neighbour names appended to each chunk's text. */
    @Min(0)
    private int relatedNodeLimit = 10;
}
