package dev.flowlang.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A trigger declaration (webhook, schedule, ...). Triggers are carried for external runners and
 * never interpreted by the engine.
 */
public record TriggerSpec(String type, Map<String, Object> config) {

    public TriggerSpec {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }
}
