package com.purchasingpower.codegraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scan repository request. Unset options use the configured defaults.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequest {

    private String rootPath;
    private Boolean includeHistory;
    private Long timeoutMs;
    private Long fileTimeoutMs;
}
