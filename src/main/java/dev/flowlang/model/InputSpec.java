package dev.flowlang.model;

/**
 * Declared flow input. A required input without a default must be supplied by the caller.
 */
public record InputSpec(
    String name,
    InputType type,
    boolean required,
    Object defaultValue // nullable
) {

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
