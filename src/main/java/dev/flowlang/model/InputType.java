package dev.flowlang.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declared type of a flow input. Documents use the lower-case name; {@code integer} and
 * {@code float} are accepted as aliases of {@link #NUMBER}.
 */
public enum InputType {
    STRING,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    ANY;

    /** Returns the matching type, or null when the value names no known type. */
    public static InputType fromValue(String value) {
        if (value == null || value.isBlank()) return ANY;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "integer":
            case "int":
            case "float":
                return NUMBER;
            case "list":
                return ARRAY;
            case "dict":
            case "map":
                return OBJECT;
            default:
                break;
        }
        for (InputType t : values()) {
            if (t.name().toLowerCase(Locale.ROOT).equals(normalized)) return t;
        }
        return null;
    }

    public boolean matches(Object value) {
        if (value == null) return true;
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT -> value instanceof Map;
            case ARRAY -> value instanceof List;
            case ANY -> true;
        };
    }

    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
