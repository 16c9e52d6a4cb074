package dev.flowlang.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named connection declared by a flow. The engine passes connection names through to the task
 * registry; the config is opaque to it.
 */
public record ConnectionSpec(String type, Map<String, Object> config) {

    public ConnectionSpec {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }
}
