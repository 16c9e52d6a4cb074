package dev.flowlang.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the execution log. The payload is small by construction: durations, error
 * messages and output names, never output values.
 */
public record ExecutionEvent(
    long sequence,
    EventType type,
    String executionId,
    String flow,
    String stepId, // nullable for flow-level events
    Instant timestamp,
    Map<String, Object> payload
) {

    public ExecutionEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
