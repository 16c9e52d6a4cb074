package dev.flowlang.model;

import java.nio.file.Path;

/**
 * Engine-wide settings. Subflow discovery starts at {@code flowsDirectory} when the calling flow
 * was not loaded from a file.
 */
public record EngineOptions(
    Path flowsDirectory,
    String canonicalFileName,
    int ancestorSearchDepth,
    int maxSubflowDepth
) {
    public static final String DEFAULT_CANONICAL_FILE_NAME = "flow.yaml";
    public static final int DEFAULT_ANCESTOR_SEARCH_DEPTH = 3;
    public static final int DEFAULT_MAX_SUBFLOW_DEPTH = 32;

    public static EngineOptions defaults() {
        return new EngineOptions(Path.of("").toAbsolutePath(), DEFAULT_CANONICAL_FILE_NAME,
            DEFAULT_ANCESTOR_SEARCH_DEPTH, DEFAULT_MAX_SUBFLOW_DEPTH);
    }

    public EngineOptions withFlowsDirectory(Path dir) {
        return new EngineOptions(dir, canonicalFileName, ancestorSearchDepth, maxSubflowDepth);
    }
}
