package dev.flowlang.model;

import java.util.List;

/**
 * Condition of a conditional step: a single expression, or a quantified group of nested
 * conditions.
 */
public sealed interface Condition {

    record Expression(String expression) implements Condition {}

    /** True when every member is true. */
    record All(List<Condition> conditions) implements Condition {
        public All {
            conditions = List.copyOf(conditions);
        }
    }

    /** True when at least one member is true. */
    record Any(List<Condition> conditions) implements Condition {
        public Any {
            conditions = List.copyOf(conditions);
        }
    }

    /** True when no member is true. */
    record None(List<Condition> conditions) implements Condition {
        public None {
            conditions = List.copyOf(conditions);
        }
    }
}
