package dev.flowlang.event;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of execution events, in the wire form streaming consumers see ({@code step_started}, ...).
 */
public enum EventType {
    FLOW_STARTED,
    STEP_STARTED,
    STEP_COMPLETED,
    STEP_FAILED,
    FLOW_COMPLETED,
    FLOW_FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean terminal() {
        return this == FLOW_COMPLETED || this == FLOW_FAILED;
    }
}
