package com.purchasingpower.codegraph.model.build;

/**
 * A recorded failure. For {@link ErrorScope#SCAN} errors {@code file} is the scanned root.
 */
public record ScanError(ErrorScope scope, String file, String message) {

    public static ScanError file(String file, String message) {
        return new ScanError(ErrorScope.FILE, file, message);
    }

    public static ScanError scan(String root, String message) {
        return new ScanError(ErrorScope.SCAN, root, message);
    }
}
