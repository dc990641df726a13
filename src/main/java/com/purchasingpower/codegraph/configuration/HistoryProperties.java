package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class HistoryProperties {

    @Min(1)
    private int maxCommitsPerFile = 50;

    @Min(1)
    private int batchSize = 10;
}
