package dev.flowlang.task;

/**
 * Per-invocation information handed to a task.
 */
public record TaskContext(
    String taskName,
    String connectionName, // nullable
    Object connection // nullable, handle resolved by the registry's ConnectionResolver
) {}
