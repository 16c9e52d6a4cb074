package dev.flowlang.model;

/**
 * Declared flow output, resolved against the final scope when the flow completes.
 */
public record OutputSpec(String name, Object value) {

    public static OutputSpec named(String name) {
        return new OutputSpec(name, "${" + name + "}");
    }
}
