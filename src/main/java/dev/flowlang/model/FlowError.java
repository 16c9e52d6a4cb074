package dev.flowlang.model;

/**
 * Structured error carried by a failed execution result.
 */
public record FlowError(ErrorKind kind, String message, String stepId) {}
