package dev.flowlang.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a synchronous flow execution.
 */
public record ExecutionResult(
    boolean success,
    Map<String, Object> outputs,
    FlowError error, // nullable
    long executionTimeMs,
    String exitReason // nullable, set when an exit step terminated the flow
) {

    public ExecutionResult {
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public static ExecutionResult completed(Map<String, Object> outputs, long executionTimeMs) {
        return new ExecutionResult(true, outputs, null, executionTimeMs, null);
    }

    public static ExecutionResult exited(Map<String, Object> outputs, String reason, long executionTimeMs) {
        return new ExecutionResult(true, outputs, null, executionTimeMs, reason);
    }

    public static ExecutionResult failed(FlowError error, long executionTimeMs) {
        return new ExecutionResult(false, Map.of(), error, executionTimeMs, null);
    }
}
