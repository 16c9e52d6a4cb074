package dev.flowlang.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One node of a flow's step tree. The fields shared by every step live here; what the step
 * does is described by its {@link StepKind}.
 */
public record Step(
    String id,
    Map<String, Object> inputs,
    List<String> outputs,
    List<String> dependsOn,
    RetryPolicy retry, // nullable
    List<Step> onError,
    Set<String> optionalInputs,
    StepKind kind
) {

    /** Prefix of ids generated for steps that declare none. Such ids cannot be referenced from expressions. */
    public static final String GENERATED_ID_PREFIX = "#";

    public Step {
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        onError = onError == null ? List.of() : List.copyOf(onError);
        optionalInputs = optionalInputs == null ? Set.of() : Set.copyOf(optionalInputs);
    }

    /** Convenience for steps with no common fields beyond id and kind. */
    public static Step of(String id, StepKind kind) {
        return new Step(id, null, null, null, null, null, null, kind);
    }

    public boolean hasGeneratedId() {
        return id.startsWith(GENERATED_ID_PREFIX);
    }

    public RetryPolicy retryOrDefault() {
        return retry != null ? retry : RetryPolicy.none();
    }

    public String kindName() {
        return kind.kindName();
    }
}
