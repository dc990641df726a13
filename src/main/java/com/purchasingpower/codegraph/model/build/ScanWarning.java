package com.purchasingpower.codegraph.model.build;

/**
 * Informational condition that did not prevent the build, such as a root outside version control.
 */
public record ScanWarning(String file, String message) {
}
