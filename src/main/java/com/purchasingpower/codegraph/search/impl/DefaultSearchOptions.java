package com.purchasingpower.codegraph.search.impl;

import com.purchasingpower.codegraph.core.SearchMode;
import com.purchasingpower.codegraph.search.SearchOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Default implementation of SearchOptions.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DefaultSearchOptions implements SearchOptions {

    @Builder.Default
    private SearchMode mode = SearchMode.HYBRID;

    @Builder.Default
    private int limit = 20;
}
