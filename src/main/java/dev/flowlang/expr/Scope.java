package dev.flowlang.expr;

import dev.flowlang.error.UndefinedReferenceException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Layered name-to-value mapping used to resolve expressions. Lookups fall through to the parent
 * scope; writes always land in this layer. Null is a legal value and distinct from "absent".
 */
public final class Scope {

    private final Scope parent;
    private final Map<String, Object> values = new LinkedHashMap<>();

    private Scope(Scope parent) {
        this.parent = parent;
    }

    public static Scope root() {
        return new Scope(null);
    }

    public static Scope root(Map<String, Object> initial) {
        Scope scope = new Scope(null);
        scope.values.putAll(initial);
        return scope;
    }

    public Scope child() {
        return new Scope(this);
    }

    public synchronized void put(String name, Object value) {
        values.put(name, value);
    }

    /**
     * Value bound to {@code name} in this scope or the nearest ancestor.
     *
     * @throws UndefinedReferenceException when no layer binds the name
     */
    public Object get(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            synchronized (s) {
                if (s.values.containsKey(name)) {
                    return s.values.get(name);
                }
            }
        }
        throw new UndefinedReferenceException(name, "Unknown variable root: " + name);
    }

    /** Snapshot of the bindings held by this layer only. */
    public synchronized Map<String, Object> locals() {
        return new LinkedHashMap<>(values);
    }

    /** Copies every binding of {@code other}'s own layer into this layer, under this scope's lock. */
    public void mergeFrom(Scope other) {
        Map<String, Object> snapshot = other.locals();
        synchronized (this) {
            values.putAll(snapshot);
        }
    }

    @Override
    public String toString() {
        return "Scope" + locals().keySet() + (parent != null ? " <- " + parent : "");
    }
}
