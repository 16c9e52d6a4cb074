package dev.flowlang.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A parsed, immutable workflow definition.
 */
public record FlowDocument(
    String name,
    String description,
    List<InputSpec> inputs,
    List<OutputSpec> outputs,
    List<Step> steps,
    Map<String, ConnectionSpec> connections,
    List<TriggerSpec> triggers,
    List<Step> onCancel,
    Path location // nullable, set when loaded from a file
) {

    public FlowDocument {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        steps = steps == null ? List.of() : List.copyOf(steps);
        connections = connections == null ? Map.of() : Map.copyOf(connections);
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        onCancel = onCancel == null ? List.of() : List.copyOf(onCancel);
    }

    /** Canonical identity used for subflow cycle detection. */
    public String identity() {
        return location != null ? location.toAbsolutePath().normalize().toString() : name;
    }

    public FlowDocument withLocation(Path path) {
        return new FlowDocument(name, description, inputs, outputs, steps, connections, triggers, onCancel, path);
    }
}
