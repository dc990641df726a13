package com.purchasingpower.codegraph.model.build;

public enum ErrorScope {
    /** One file failed or timed out; the rest of the scan went on. */
    FILE,
    /** The scan as a whole is affected (no files, overall timeout). */
    SCAN
}
