package com.purchasingpower.codegraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Search request. {@code mode} is {@code keyword}, {@code semantic} or {@code hybrid}.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    private String rootPath;
    private String query;
    private String mode;
    private Integer limit;
}
