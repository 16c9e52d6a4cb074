package dev.flowlang.subflow;

import dev.flowlang.model.FlowDocument;

import java.nio.file.Path;

/**
 * Canonical identity of a flow, plus the directory relative subflow references are resolved from.
 */
public record FlowSource(
    String identity,
    String name,
    Path directory // null for flows not loaded from disk
) {

    public static FlowSource of(FlowDocument document) {
        Path location = document.location();
        return new FlowSource(document.identity(), document.name(),
            location != null ? location.toAbsolutePath().normalize().getParent() : null);
    }
}
