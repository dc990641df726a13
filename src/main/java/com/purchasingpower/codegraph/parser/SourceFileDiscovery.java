package com.purchasingpower.codegraph.parser;

import java.nio.file.Path;
import java.util.List;

/**
 * Finds the source files a scan analyzes.
 *
 * @since 1.0.0
 */
public interface SourceFileDiscovery {

    /**
     * @return root-relative, {@code /}-separated paths in sorted order
     */
    List<String> discover(Path root);
}
