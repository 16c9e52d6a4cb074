package dev.flowlang.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal signal raised by an exit step. It travels up through every enclosing step list until
 * the innermost flow or subflow boundary absorbs it.
 */
public record ExitSignal(String reason, Map<String, Object> outputs) {

    public ExitSignal {
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }
}
