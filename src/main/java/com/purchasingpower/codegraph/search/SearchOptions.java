package com.purchasingpower.codegraph.search;

import com.purchasingpower.codegraph.core.SearchMode;

/**
 * Search options for customizing search behavior.
 *
 * @since 1.0.0
 */
public interface SearchOptions {

    SearchMode getMode();

    /**
     * Maximum number of results returned, in every mode.
     */
    int getLimit();
}
