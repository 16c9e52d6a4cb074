package dev.flowlang.subflow;

import dev.flowlang.model.FlowDocument;

/**
 * A resolved and parsed subflow.
 */
public record LoadedFlow(FlowSource source, FlowDocument document) {}
