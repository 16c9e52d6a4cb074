package dev.flowlang.error;

import dev.flowlang.model.ErrorKind;

import java.util.List;

/**
 * A subflow call would re-enter a flow already on the call chain.
 */
public class CircularDependencyException extends FlowException {

    private final List<String> chain;

    public CircularDependencyException(List<String> chain) {
        super(ErrorKind.CIRCULAR_DEPENDENCY, "Circular subflow dependency detected: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
