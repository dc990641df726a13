package com.purchasingpower.codegraph.model.build;

import lombok.Builder;
import lombok.Value;

/**
 * Per-build overrides. Unset values fall back to {@code codegraph.scan.*}.
 */
@Value
@Builder
public class BuildOptions {

    Boolean includeHistory;
    Long timeoutMs;
    Long fileTimeoutMs;
    @Builder.Default
    ProgressListener progressListener = ProgressListener.NONE;

    public static BuildOptions defaults() {
        return BuildOptions.builder().build();
    }
}
